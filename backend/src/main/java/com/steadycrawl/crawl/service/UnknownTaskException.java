package com.steadycrawl.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class UnknownTaskException extends RuntimeException {
    public UnknownTaskException(String message) {
        super(message);
    }
}
