package com.csd.leadscore.model;

public enum ChatIntent {
    TOP_LEADS,          // "Who are the top 5 leads?"
    HIGH_PRIORITY,      // "Show me all high priority leads"
    URGENT,             // "Which companies have urgent needs?"
    BUDGET,             // "Who has budget approval?"
    LOWEST,             // "Which leads scored lowest?"
    SUMMARY,            // "Give me an overview"
    GENERAL,            // lead related, no fixed answer shape
    CASUAL              // not about leads at all
}
