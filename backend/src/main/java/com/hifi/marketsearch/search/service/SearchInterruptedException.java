package com.hifi.marketsearch.search.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class SearchInterruptedException extends RuntimeException {
    public SearchInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
