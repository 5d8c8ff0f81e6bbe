package com.arcs.model;

import com.arcs.ArcsException;

// Bad field input (quantity, prices) or an item index that doesn't exist.
public class QuoteValidationException extends ArcsException {

    public QuoteValidationException(String message) {
        super(message);
    }
}
