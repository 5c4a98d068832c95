package com.apispec.schemaGraph.naming;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Entity, type and parameter name helpers shared by the catalog builder and the
 * relationship detectors.
 */
public final class EntityNames {
    /** Entity used for operations that declare no tag. */
    public static final String DEFAULT_TAG = "Default";

    private static final Set<String> RESERVED_WORDS = Set.of(
        "abstract","assert","boolean","break","byte","case","catch","char","class","const","continue",
        "default","do","double","else","enum","extends","false","final","finally","float","for","goto",
        "if","implements","import","instanceof","int","interface","long","native","new","null","package",
        "private","protected","public","return","short","static","strictfp","super","switch","synchronized",
        "this","throw","throws","transient","true","try","void","volatile","while","record","var","yield",
        "function","delete","typeof","let","await","export","in","with","debugger"
    );

    private EntityNames() {
    }

    public static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    /**
     * Joins the words of an identifier in PascalCase, keeping the inner casing of each word.
     * E.g. "order_items" -> "OrderItems", "userProfile" -> "UserProfile".
     */
    public static String toPascalCase(String value) {
        List<String> words = IdentifierNormalizer.splitWords(value);
        StringBuilder builder = new StringBuilder();
        for (String word : words) {
            builder.append(capitalize(word));
        }
        return builder.toString();
    }

    /**
     * Naive English singularization: "categories" -> "category", "addresses" -> "address",
     * "users" -> "user". Words ending in "ss", "us" or "is" are left alone.
     */
    public static String singularize(String word) {
        if (word == null || word.length() < 2) {
            return word;
        }
        String lower = word.toLowerCase(Locale.ROOT);
        if (lower.endsWith("ies") && word.length() > 3) {
            return word.substring(0, word.length() - 3) + (Character.isUpperCase(word.charAt(word.length() - 1)) ? "Y" : "y");
        }
        if (lower.endsWith("sses")) {
            return word.substring(0, word.length() - 2);
        }
        if (lower.endsWith("ss") || lower.endsWith("us") || lower.endsWith("is")) {
            return word;
        }
        if (lower.endsWith("s")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    public static boolean isPlural(String word) {
        return word != null && !word.equals(singularize(word));
    }

    /**
     * Maps a tag to its entity name: "users" -> "User", "order-items" -> "OrderItem".
     * Blank tags map to {@link #DEFAULT_TAG}.
     */
    public static String entityNameForTag(String tag) {
        String pascal = toPascalCase(tag);
        if (pascal.isEmpty()) {
            return DEFAULT_TAG;
        }
        return singularize(pascal);
    }

    /** Maps a static path segment to its entity name: "orders" -> "Order". */
    public static String entityNameForSegment(String segment) {
        return singularize(toPascalCase(segment));
    }

    /**
     * Remaps type names that collide with built-in names of common emit targets.
     */
    public static String remapReservedTypeName(String typeName) {
        if ("Object".equals(typeName)) {
            return "ObjectDto";
        }
        return typeName;
    }

    /**
     * Produces an identifier-safe parameter name: separators camelize the following
     * character ("user-id" -> "userId"), remaining invalid characters become underscores,
     * and reserved words get a "Param" suffix.
     */
    public static String sanitizeParameterName(String originalName) {
        if (originalName == null || originalName.isBlank()) {
            return "param";
        }
        String sanitized = originalName.trim().replaceAll("^\\$+", "");
        if (sanitized.isEmpty()) {
            return "param";
        }

        StringBuilder camelized = new StringBuilder();
        boolean upperNext = false;
        for (int i = 0; i < sanitized.length(); i++) {
            char c = sanitized.charAt(i);
            if (c == '-' || c == '_' || c == '.' || Character.isWhitespace(c)) {
                upperNext = camelized.length() > 0;
                continue;
            }
            camelized.append(upperNext ? Character.toUpperCase(c) : c);
            upperNext = false;
        }
        if (camelized.length() == 0) {
            return "param";
        }

        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < camelized.length(); i++) {
            char c = camelized.charAt(i);
            boolean valid = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
            if (i == 0 && c >= '0' && c <= '9') {
                builder.append('_');
            }
            builder.append(valid ? c : '_');
        }

        String candidate = builder.toString();
        if (RESERVED_WORDS.contains(candidate)) {
            candidate = candidate + "Param";
        }
        return candidate;
    }

    /**
     * Returns {@code desiredName} or, if already taken, the first free {@code desiredName2},
     * {@code desiredName3}, ... The chosen name is added to {@code usedNames}.
     */
    public static String makeUnique(String desiredName, Set<String> usedNames) {
        String baseName = (desiredName == null || desiredName.isBlank()) ? "param" : desiredName;
        String candidate = baseName;
        int counter = 2;
        while (usedNames.contains(candidate)) {
            candidate = baseName + counter;
            counter++;
        }
        usedNames.add(candidate);
        return candidate;
    }
}
