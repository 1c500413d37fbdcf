package com.tsrouter.exception;

/**
 * A query was rejected before being forwarded: unparseable, forbidden or violating the query policy.
 */
public class MalformedQueryException extends MalformedInputException {

    public MalformedQueryException(String message) {
        super(message);
    }
}
