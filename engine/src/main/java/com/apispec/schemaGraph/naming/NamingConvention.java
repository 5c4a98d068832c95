package com.apispec.schemaGraph.naming;

/**
 * Naming convention detected on a raw operation or tag identifier.
 */
public enum NamingConvention {
    /** {@code Tag_Method}: exactly one underscore separating two identifiers. */
    TAG_METHOD,
    SNAKE_CASE,
    KEBAB_CASE,
    CAMEL_CASE,
    PASCAL_CASE,
    /** Identifier characters mixed with other separators, e.g. {@code "get users!"}. */
    MIXED,
    /** Nothing usable left after stripping non-identifier characters. */
    UNKNOWN
}
