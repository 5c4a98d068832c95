package com.apispec.schemaGraph.exceptions;

public class SpecLoadException extends SchemaGraphException {
    private final String source;

    public SpecLoadException(String message, String source) {
        super(message);
        this.source = source;
    }

    public SpecLoadException(String message, String source, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
