package com.calexport.indexer.model;

import java.util.List;
import java.util.Objects;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Base class for every parsed object. Instances are built once by a body parser and never
 * modified afterwards.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class CalObject implements PropertyHolder {
    private final ObjectHeader header;
    private final List<Property> properties;

    protected CalObject(ObjectHeader header, List<Property> properties) {
        this.header = Objects.requireNonNull(header, "header");
        this.properties = properties != null ? List.copyOf(properties) : List.of();
    }

    public ObjectKind getKind() {
        return header.getKind();
    }

    public int getId() {
        return header.getId();
    }

    public String getName() {
        return header.getName();
    }

    public ObjectMetadata getMetadata() {
        return header.getMetadata();
    }

    public ObjectKey getKey() {
        return header.getKey();
    }

    public abstract <R> R accept(CalObjectVisitor<R> visitor);
}
