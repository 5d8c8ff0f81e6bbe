package com.arcs.storage;

import com.arcs.ArcsException;

// The quote file is missing or doesn't hold a readable quote document.
public class QuoteParseException extends ArcsException {

    public QuoteParseException(String message) {
        super(message);
    }

    public QuoteParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
