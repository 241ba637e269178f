package com.calexport.indexer.parser;

import java.util.Set;

import com.calexport.indexer.model.CodeunitObject;
import com.calexport.indexer.model.ObjectHeader;
import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.parser.grammar.CodeSection;

/**
 * Codeunits. CODE is required; OnRun and the other triggers stay in the property list.
 */
public class CodeunitParser extends AbstractObjectParser<CodeunitObject> {

    @Override
    protected Set<ObjectKind> supportedKinds() {
        return Set.of(ObjectKind.CODEUNIT);
    }

    @Override
    protected CodeunitObject parseBody(ObjectHeader header, String text) {
        Section code = require(text, "CODE", header);
        CodeSection parsed = codeSectionParser.parse(code.getBody());
        return CodeunitObject.builder()
                .header(header)
                .properties(objectProperties(text))
                .variables(parsed.getVariables())
                .procedures(parsed.getProcedures())
                .build();
    }
}
