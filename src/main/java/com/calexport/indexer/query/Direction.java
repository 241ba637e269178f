package com.calexport.indexer.query;

import java.util.Arrays;
import java.util.Optional;

public enum Direction {
    INCOMING,
    OUTGOING,
    BOTH;

    public boolean includesIncoming() {
        return this != OUTGOING;
    }

    public boolean includesOutgoing() {
        return this != INCOMING;
    }

    public static Optional<Direction> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.of(BOTH);
        }
        return Arrays.stream(values())
                .filter(d -> d.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
