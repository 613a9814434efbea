package com.example.changefeed.exception;

public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String action, String resource) {
        super("Not allowed to " + action + " this " + resource);
    }
}
