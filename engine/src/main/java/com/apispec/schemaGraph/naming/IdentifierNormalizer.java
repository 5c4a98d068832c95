package com.apispec.schemaGraph.naming;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Converts raw operation and tag identifiers into camelCase names.
 *
 * All methods are pure: identical input always yields identical output, and no
 * input makes them throw. A blank result means "unnamed" and callers substitute
 * {@link #fallbackOperationName(String, String)}.
 *
 * Conversion examples:
 * - "Users_GetById" -> "usersGetById"
 * - "get_users_by_status" -> "getUsersByStatus"
 * - "create-user" -> "createUser"
 * - "HTTPServerStatus" -> "httpServerStatus"
 * - "special!@#$%Chars" -> "specialChars"
 * - "!!!" -> ""
 */
public final class IdentifierNormalizer {
    private static final Pattern TAG_METHOD_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9]*_[A-Za-z][A-Za-z0-9]*$");
    private static final Pattern SNAKE_CASE_PATTERN = Pattern.compile("^[a-z0-9]+(_[a-z0-9]+)+$");
    private static final Pattern KEBAB_CASE_PATTERN = Pattern.compile("^[a-z0-9]+(-[a-z0-9]+)+$");
    private static final Pattern CAMEL_CASE_PATTERN = Pattern.compile("^[a-z][a-zA-Z0-9]*$");
    private static final Pattern PASCAL_CASE_PATTERN = Pattern.compile("^[A-Z][a-zA-Z0-9]*$");

    private IdentifierNormalizer() {
    }

    /**
     * Normalizes an identifier of any convention to camelCase.
     *
     * @param identifier raw identifier, may be null or empty
     * @return camelCase name matching {@code ^[a-z_][a-zA-Z0-9_]*$}, or an empty string
     */
    public static String normalize(String identifier) {
        List<String> words = splitWords(identifier);
        if (words.isEmpty()) {
            return "";
        }

        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i);
            if (i == 0) {
                builder.append(word.toLowerCase(Locale.ROOT));
            } else {
                builder.append(Character.toUpperCase(word.charAt(0)))
                       .append(word.substring(1).toLowerCase(Locale.ROOT));
            }
        }

        if (Character.isDigit(builder.charAt(0))) {
            builder.insert(0, '_');
        }
        return builder.toString();
    }

    /**
     * Normalizes an operationId. A {@code Tag_Method} id contributes only its
     * method segment ("Pets_List" -> "list"); any other id is normalized whole.
     */
    public static String normalizeOperationId(String operationId) {
        if (operationId == null) {
            return "";
        }
        String trimmed = operationId.trim();
        if (detectConvention(trimmed) == NamingConvention.TAG_METHOD) {
            return normalize(trimmed.substring(trimmed.indexOf('_') + 1));
        }
        return normalize(trimmed);
    }

    /**
     * Builds the {@code <method><Resource>} name used when an operation has no usable operationId.
     * E.g. "get" + "pets" -> "getPets", "post" + "Order Items" -> "postOrderItems".
     */
    public static String fallbackOperationName(String httpMethod, String resource) {
        String method = httpMethod == null ? "" : httpMethod;
        String fallback = normalize(method + " " + (resource == null ? "" : resource));
        if (fallback.isEmpty()) {
            return "operation";
        }
        return fallback;
    }

    /**
     * Resolves the final operation name: the normalized operationId when it yields
     * a name, otherwise the method + resource fallback.
     */
    public static String operationName(String operationId, String httpMethod, String resource) {
        String normalized = normalizeOperationId(operationId);
        if (!normalized.isEmpty()) {
            return normalized;
        }
        return fallbackOperationName(httpMethod, resource);
    }

    public static NamingConvention detectConvention(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return NamingConvention.UNKNOWN;
        }
        String candidate = identifier.trim();

        if (TAG_METHOD_PATTERN.matcher(candidate).matches()) {
            return NamingConvention.TAG_METHOD;
        }
        if (SNAKE_CASE_PATTERN.matcher(candidate).matches()) {
            return NamingConvention.SNAKE_CASE;
        }
        if (KEBAB_CASE_PATTERN.matcher(candidate).matches()) {
            return NamingConvention.KEBAB_CASE;
        }
        if (CAMEL_CASE_PATTERN.matcher(candidate).matches()) {
            return NamingConvention.CAMEL_CASE;
        }
        if (PASCAL_CASE_PATTERN.matcher(candidate).matches()) {
            return NamingConvention.PASCAL_CASE;
        }
        return splitWords(candidate).isEmpty() ? NamingConvention.UNKNOWN : NamingConvention.MIXED;
    }

    /**
     * Splits an identifier into words at separators and case boundaries.
     * Only ASCII letters and digits are word characters; everything else separates.
     * An upper-case letter starts a new word after a lower-case letter or a digit,
     * and ends an acronym run when followed by a lower-case letter ("HTTPServer" -> HTTP, Server).
     */
    static List<String> splitWords(String identifier) {
        List<String> words = new ArrayList<>();
        if (identifier == null || identifier.isEmpty()) {
            return words;
        }

        StringBuilder current = new StringBuilder();
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (!isAsciiLetterOrDigit(c)) {
                flush(current, words);
                continue;
            }

            if (current.length() > 0 && isUpper(c)) {
                char previous = current.charAt(current.length() - 1);
                boolean afterLowerOrDigit = isLower(previous) || Character.isDigit(previous);
                boolean endsAcronym = isUpper(previous)
                        && i + 1 < identifier.length()
                        && isLower(identifier.charAt(i + 1));
                if (afterLowerOrDigit || endsAcronym) {
                    flush(current, words);
                }
            }
            current.append(c);
        }
        flush(current, words);
        return words;
    }

    private static void flush(StringBuilder current, List<String> words) {
        if (current.length() > 0) {
            words.add(current.toString());
            current.setLength(0);
        }
    }

    private static boolean isAsciiLetterOrDigit(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }

    private static boolean isUpper(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static boolean isLower(char c) {
        return c >= 'a' && c <= 'z';
    }
}
