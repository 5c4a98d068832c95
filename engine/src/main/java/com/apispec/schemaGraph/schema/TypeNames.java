package com.apispec.schemaGraph.schema;

/**
 * Type name markers produced by {@link TypeResolver} when no named type applies.
 */
public final class TypeNames {
    /** No schema present for a response or body. */
    public static final String VOID = "void";
    /** Schema present but opaque. */
    public static final String ANY = "any";
    /** Inline object shape with no name. */
    public static final String OBJECT = "object";
    /** Inline array with no resolvable item name. */
    public static final String ANY_ARRAY = "any[]";

    public static final String NUMBER = "number";
    public static final String BOOLEAN = "boolean";
    public static final String STRING = "string";

    public static final String ARRAY_SUFFIX = "[]";

    private TypeNames() {
    }

    public static String arrayOf(String itemType) {
        return itemType + ARRAY_SUFFIX;
    }
}
