package com.calexport.indexer.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class TableObject extends CodeBearingObject {
    private final List<Field> fields;
    private final List<TableKey> keys;
    private final List<FieldGroup> fieldGroups;
    private final String permissions;
    private final Integer lookupPageId;
    private final Integer drillDownPageId;

    @Builder
    public TableObject(ObjectHeader header, List<Property> properties, List<Variable> variables,
                       List<Procedure> procedures, List<Field> fields, List<TableKey> keys,
                       List<FieldGroup> fieldGroups, String permissions, Integer lookupPageId,
                       Integer drillDownPageId) {
        super(header, properties, variables, procedures);
        this.fields = fields != null ? List.copyOf(fields) : List.of();
        this.keys = keys != null ? List.copyOf(keys) : List.of();
        this.fieldGroups = fieldGroups != null ? List.copyOf(fieldGroups) : List.of();
        this.permissions = permissions;
        this.lookupPageId = lookupPageId;
        this.drillDownPageId = drillDownPageId;
    }

    public Optional<String> permissions() {
        return Optional.ofNullable(permissions);
    }

    public Optional<Integer> lookupPageId() {
        return Optional.ofNullable(lookupPageId);
    }

    public Optional<Integer> drillDownPageId() {
        return Optional.ofNullable(drillDownPageId);
    }

    public Optional<Field> findField(String name) {
        return fields.stream()
                .filter(f -> f.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    public Optional<TableKey> primaryKey() {
        return keys.isEmpty() ? Optional.empty() : Optional.of(keys.get(0));
    }

    @Override
    public <R> R accept(CalObjectVisitor<R> visitor) {
        return visitor.visitTable(this);
    }
}
