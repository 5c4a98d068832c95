package com.apispec.schemaGraph.exceptions;

public class SchemaGraphException extends RuntimeException {
    public SchemaGraphException(String message) {
        super(message);
    }

    public SchemaGraphException(String message, Throwable cause) {
        super(message, cause);
    }

    public SchemaGraphException(Throwable cause) {
        super(cause);
    }
}
