package com.arcs.export;

import com.arcs.ArcsException;

public class QuoteExportException extends ArcsException {

    public QuoteExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
