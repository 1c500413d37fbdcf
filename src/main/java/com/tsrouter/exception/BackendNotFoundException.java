package com.tsrouter.exception;

public class BackendNotFoundException extends RouterException {

    private final String name;

    public BackendNotFoundException(String name) {
        super("backend not found: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
