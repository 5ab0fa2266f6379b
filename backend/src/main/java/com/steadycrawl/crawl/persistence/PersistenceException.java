package com.steadycrawl.crawl.persistence;

/**
 * A state file could not be read or replaced. The store's previous content is still in effect.
 */
public class PersistenceException extends RuntimeException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
