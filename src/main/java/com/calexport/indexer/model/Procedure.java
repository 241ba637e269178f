package com.calexport.indexer.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A procedure of a CODE section. The body is the raw text between BEGIN and its
 * matching END and is never interpreted.
 */
@Value
@Builder
public class Procedure {
    int id;
    String name;
    @Singular
    List<Parameter> parameters;
    String returnType;
    @Builder.Default
    String body = "";
    @Singular
    List<Variable> localVariables;
    boolean local;
    /** Bracketed attribute lines preceding the header, e.g. {@code [External]}. */
    @Singular
    List<String> attributes;

    public boolean isEventSubscriber() {
        return attributes.stream().anyMatch(a -> a.startsWith("[EventSubscriber"));
    }

    public boolean isExternal() {
        return attributes.stream().anyMatch(a -> a.equalsIgnoreCase("[External]"));
    }

    public List<String> getBodyLines() {
        return body.isEmpty() ? List.of() : body.lines().toList();
    }

    public String getSignature() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < parameters.size(); i++) {
            Parameter p = parameters.get(i);
            if (i > 0) {
                sb.append(';');
            }
            if (p.isByRef()) {
                sb.append("VAR ");
            }
            sb.append(p.getName()).append(" : ").append(p.getType());
        }
        sb.append(')');
        if (returnType != null) {
            sb.append(" : ").append(returnType);
        }
        return sb.toString();
    }
}
