package com.calexport.indexer.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class CodeunitObject extends CodeBearingObject {

    @Builder
    public CodeunitObject(ObjectHeader header, List<Property> properties, List<Variable> variables,
                          List<Procedure> procedures) {
        super(header, properties, variables, procedures);
    }

    /** Body of the OnRun trigger, as written in PROPERTIES. */
    public Optional<String> onRun() {
        return propertyValue("OnRun");
    }

    public Optional<String> subtype() {
        return propertyValue("Subtype");
    }

    public boolean isSingleInstance() {
        return isFlagSet("SingleInstance");
    }

    @Override
    public <R> R accept(CalObjectVisitor<R> visitor) {
        return visitor.visitCodeunit(this);
    }
}
