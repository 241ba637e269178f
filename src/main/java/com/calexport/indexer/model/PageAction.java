package com.calexport.indexer.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Entry of a page's ACTIONS list. Actions are kept flat; {@code level} is informational.
 */
@Value
@Builder
public class PageAction implements PropertyHolder {
    int id;
    int level;
    String type;
    String name;
    @Singular
    Map<String, String> captions;
    ObjectKey runObject;
    @Singular
    List<Property> properties;

    public Optional<ObjectKey> runObject() {
        return Optional.ofNullable(runObject);
    }

    public String getDisplayName() {
        if (name != null) {
            return name;
        }
        return captions.getOrDefault("ENU", String.valueOf(id));
    }
}
