package com.csd.leadscore.model;

public enum ExportScope {
    ALL,
    PER_PRIORITY
}
