package com.samplepairs.app;

import java.io.IOException;

/**
 * Non-success response from the catalog API.
 */
public class CatalogException extends IOException {
    private final int statusCode;

    public CatalogException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
