package com.steadycrawl.crawl.http;

public enum CircuitState {
    /** Normal operation, every call passes. */
    CLOSED,
    /** Failing fast, no network call is attempted. */
    OPEN,
    /** Probing recovery with a bounded number of trial calls. */
    HALF_OPEN
}
