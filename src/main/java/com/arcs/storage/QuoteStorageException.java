package com.arcs.storage;

import com.arcs.ArcsException;

// Permission / path problems while writing quote files.
public class QuoteStorageException extends ArcsException {

    public QuoteStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
