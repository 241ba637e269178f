package com.calexport.indexer.model;

import java.util.Optional;
import java.util.regex.Pattern;

import lombok.NonNull;
import lombok.Value;

/**
 * One {@code Name=value} entry of a property list. The value is kept exactly as written
 * (trimmed); {@link #getType()} only classifies it.
 */
@Value
public class Property {

    private static final Pattern NUMBER = Pattern.compile("^-?\\d+(?:\\.\\d+)?$");
    private static final Pattern SMALL_INT = Pattern.compile("^-?\\d{1,10}$");
    private static final Pattern CODE = Pattern.compile("^(?:BEGIN|VAR)\\b");

    @NonNull
    String name;
    @NonNull
    String value;
    @NonNull
    PropertyType type;

    public static Property of(String name, String value) {
        String v = value == null ? "" : value.trim();
        return new Property(name.trim(), v, classify(v));
    }

    private static PropertyType classify(String value) {
        if ("Yes".equalsIgnoreCase(value) || "No".equalsIgnoreCase(value)) {
            return PropertyType.BOOLEAN;
        }
        if (NUMBER.matcher(value).matches()) {
            return PropertyType.NUMBER;
        }
        if (CODE.matcher(value).find()) {
            return PropertyType.CODE;
        }
        return PropertyType.TEXT;
    }

    public Optional<Boolean> asBoolean() {
        if (type != PropertyType.BOOLEAN) {
            return Optional.empty();
        }
        return Optional.of("Yes".equalsIgnoreCase(value));
    }

    public Optional<Integer> asInteger() {
        if (type != PropertyType.NUMBER || !SMALL_INT.matcher(value).matches()) {
            return Optional.empty();
        }
        long parsed = Long.parseLong(value);
        return parsed >= Integer.MIN_VALUE && parsed <= Integer.MAX_VALUE
                ? Optional.of((int) parsed)
                : Optional.empty();
    }
}
