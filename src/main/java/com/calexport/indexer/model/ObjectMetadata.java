package com.calexport.indexer.model;

import java.util.Optional;

import lombok.Builder;
import lombok.Value;

/**
 * The OBJECT-PROPERTIES block of an export. Every entry is optional.
 */
@Value
@Builder
public class ObjectMetadata {

    public static final ObjectMetadata EMPTY = ObjectMetadata.builder().build();

    String date;
    String time;
    String versionList;

    public Optional<String> date() {
        return Optional.ofNullable(date);
    }

    public Optional<String> time() {
        return Optional.ofNullable(time);
    }

    public Optional<String> versionList() {
        return Optional.ofNullable(versionList);
    }

    public boolean isEmpty() {
        return date == null && time == null && versionList == null;
    }
}
