package com.csd.leadscore.service;

import com.csd.leadscore.model.ChatIntent;
import com.csd.leadscore.model.QueryIntent;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LeadQueryParserTest {

    private final LeadQueryParser parser = new LeadQueryParser();

    @Test
    void topLeadsWithLimit() {
        QueryIntent intent = parser.parse("Who are the top 3 leads I should contact?");
        assertEquals(ChatIntent.TOP_LEADS, intent.getIntent());
        assertEquals(3, intent.getLimit());
    }

    @Test
    void topLeadsDefaultLimit() {
        QueryIntent intent = parser.parse("Which is my best lead?");
        assertEquals(ChatIntent.TOP_LEADS, intent.getIntent());
        assertEquals(LeadQueryParser.DEFAULT_LIMIT, intent.getLimit());
    }

    @Test
    void highPriorityBeforeTop() {
        assertEquals(ChatIntent.HIGH_PRIORITY, parser.parse("Tell me about the 4 high priority leads").getIntent());
    }

    @Test
    void lowest() {
        QueryIntent intent = parser.parse("Show the bottom 2 leads");
        assertEquals(ChatIntent.LOWEST, intent.getIntent());
        assertEquals(2, intent.getLimit());
    }

    @Test
    void urgentAndBudget() {
        assertEquals(ChatIntent.URGENT, parser.parse("Which companies have urgent needs?").getIntent());
        assertEquals(ChatIntent.BUDGET, parser.parse("Who has budget approval?").getIntent());
    }

    @Test
    void summaryAndGeneral() {
        assertEquals(ChatIntent.SUMMARY, parser.parse("Give me an overview of my leads").getIntent());
        assertEquals(ChatIntent.GENERAL, parser.parse("What patterns do you see in my leads?").getIntent());
    }

    @Test
    void casualChat() {
        assertEquals(ChatIntent.CASUAL, parser.parse("Hello, how are you?").getIntent());
        assertEquals(ChatIntent.CASUAL, parser.parse("").getIntent());
        assertEquals(ChatIntent.CASUAL, parser.parse(null).getIntent());
    }
}
