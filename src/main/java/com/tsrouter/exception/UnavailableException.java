package com.tsrouter.exception;

/**
 * No healthy backend can take the request.
 */
public class UnavailableException extends RouterException {

    public UnavailableException(String message) {
        super(message);
    }
}
