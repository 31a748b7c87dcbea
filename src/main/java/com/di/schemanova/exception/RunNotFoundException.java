package com.di.schemanova.exception;

/** No analysis run (or no dataset within it) exists for the requested id. */
public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(String message) {
        super(message);
    }
}
