package com.steadycrawl.crawl.model;

public enum CollectionRunStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    STOPPED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
