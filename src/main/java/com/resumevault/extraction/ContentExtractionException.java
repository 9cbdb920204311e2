package com.resumevault.extraction;

public class ContentExtractionException extends Exception {

    public ContentExtractionException(String message) {
        super(message);
    }

    public ContentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
