package com.tsrouter.exception;

/**
 * A line of the ingestion protocol could not be parsed.
 */
public class MalformedInputException extends RouterException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
