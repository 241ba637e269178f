package com.calexport.indexer.query;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum MemberCategory {
    FIELDS("fields"),
    KEYS("keys"),
    FIELD_GROUPS("fieldgroups"),
    PROCEDURES("procedures"),
    VARIABLES("variables"),
    CONTROLS("controls"),
    ACTIONS("actions"),
    DATA_ITEMS("dataitems"),
    COLUMNS("columns"),
    FILTERS("filters"),
    NODES("nodes"),
    MENU_ITEMS("menuitems");

    private final String label;

    MemberCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Label or constant name in any case; underscores, dashes and spaces are ignored, and a
     * missing trailing {@code s} is tolerated ({@code procedure}, {@code data-item}).
     */
    public static Optional<MemberCategory> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replaceAll("[_\\-\\s]", "");
        return Arrays.stream(values())
                .filter(c -> c.label.equals(normalized) || c.label.equals(normalized + "s"))
                .findFirst();
    }

    @Override
    public String toString() {
        return label;
    }
}
