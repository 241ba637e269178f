package com.calexport.indexer.model;

import java.util.Arrays;
import java.util.Optional;

public enum PortNodeType {
    ELEMENT("Element"),
    ATTRIBUTE("Attribute"),
    FIELD("Field"),
    TEXT("Text");

    private final String token;

    PortNodeType(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static Optional<PortNodeType> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String trimmed = token.trim();
        return Arrays.stream(values())
                .filter(t -> t.token.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
