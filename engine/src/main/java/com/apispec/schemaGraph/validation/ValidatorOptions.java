package com.apispec.schemaGraph.validation;

/**
 * @param strict when {@code true}, warnings make a document invalid too
 */
public record ValidatorOptions(boolean strict) {

    public static ValidatorOptions defaults() {
        return new ValidatorOptions(false);
    }
}
