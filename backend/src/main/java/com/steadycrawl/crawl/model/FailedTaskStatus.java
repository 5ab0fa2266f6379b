package com.steadycrawl.crawl.model;

public enum FailedTaskStatus {
    PENDING,
    RETRYING,
    EXHAUSTED,
    RESOLVED
}
