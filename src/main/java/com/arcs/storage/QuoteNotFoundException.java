package com.arcs.storage;

import com.arcs.ArcsException;

public class QuoteNotFoundException extends ArcsException {

    public QuoteNotFoundException(String id) {
        super("No quote with id " + id);
    }
}
