package com.calexport.indexer.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The eight object kinds a C/AL text export can contain.
 */
public enum ObjectKind {
    TABLE("Table"),
    PAGE("Page"),
    FORM("Form"),
    CODEUNIT("Codeunit"),
    REPORT("Report"),
    XMLPORT("XMLport"),
    QUERY("Query"),
    MENUSUITE("MenuSuite");

    private final String token;

    ObjectKind(String token) {
        this.token = token;
    }

    /**
     * The literal spelling used in {@code OBJECT <kind> <id> <name>} header lines.
     */
    public String getToken() {
        return token;
    }

    /**
     * Exact, case-sensitive match against the header token.
     */
    public static Optional<ObjectKind> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(kind -> kind.token.equals(token))
                .findFirst();
    }

    /**
     * Lenient lookup for user input: accepts the header token or the enum name in any case.
     */
    public static Optional<ObjectKind> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(kind -> kind.token.equalsIgnoreCase(trimmed) || kind.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }

    @Override
    public String toString() {
        return token;
    }
}
