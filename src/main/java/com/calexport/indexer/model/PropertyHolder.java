package com.calexport.indexer.model;

import java.util.List;
import java.util.Optional;

/**
 * Anything that carries a property bag. Lookups ignore case, first match wins.
 */
public interface PropertyHolder {

    List<Property> getProperties();

    default Optional<Property> findProperty(String name) {
        return getProperties().stream()
                .filter(p -> p.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    default Optional<String> propertyValue(String name) {
        return findProperty(name).map(Property::getValue);
    }

    default boolean isFlagSet(String name) {
        return findProperty(name).flatMap(Property::asBoolean).orElse(false);
    }
}
