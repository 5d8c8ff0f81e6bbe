package com.arcs;

/**
 * Root of every checked failure the quote manager reports to the user.
 */
public class ArcsException extends Exception {

    public ArcsException(String message) {
        super(message);
    }

    public ArcsException(String message, Throwable cause) {
        super(message, cause);
    }
}
