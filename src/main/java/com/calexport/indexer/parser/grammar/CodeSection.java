package com.calexport.indexer.parser.grammar;

import java.util.List;

import com.calexport.indexer.model.Procedure;
import com.calexport.indexer.model.Variable;

import lombok.Value;

/**
 * Global variables and procedures of one CODE section.
 */
@Value
public class CodeSection {
    public static final CodeSection EMPTY = new CodeSection(List.of(), List.of());

    List<Variable> variables;
    List<Procedure> procedures;
}
