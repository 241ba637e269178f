package com.calexport.indexer.model;

import java.util.List;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Object kinds that have a CODE section with global variables and procedures.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public abstract class CodeBearingObject extends CalObject {
    private final List<Variable> variables;
    private final List<Procedure> procedures;

    protected CodeBearingObject(ObjectHeader header, List<Property> properties,
                                List<Variable> variables, List<Procedure> procedures) {
        super(header, properties);
        this.variables = variables != null ? List.copyOf(variables) : List.of();
        this.procedures = procedures != null ? List.copyOf(procedures) : List.of();
    }

    public Optional<Procedure> findProcedure(String name) {
        return procedures.stream()
                .filter(p -> p.getName().equalsIgnoreCase(name))
                .findFirst();
    }
}
