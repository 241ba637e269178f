package com.calexport.indexer.parser;

import java.util.Set;

import com.calexport.indexer.model.ObjectHeader;
import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.model.ReportObject;
import com.calexport.indexer.parser.grammar.CodeSection;

/**
 * Reports. DATASET is required; PROPERTIES and CODE are optional.
 */
public class ReportParser extends AbstractObjectParser<ReportObject> {

    private final DataItemSectionParser dataItemParser = new DataItemSectionParser(propertyParser, hierarchyBuilder);

    @Override
    protected Set<ObjectKind> supportedKinds() {
        return Set.of(ObjectKind.REPORT);
    }

    @Override
    protected ReportObject parseBody(ObjectHeader header, String text) {
        DataItemSectionParser.Result dataset = dataItemParser.parse(require(text, "DATASET", header));
        CodeSection code = codeSection(text);
        return ReportObject.builder()
                .header(header)
                .properties(objectProperties(text))
                .dataItems(dataset.getRoots())
                .columns(dataset.getColumns())
                .variables(code.getVariables())
                .procedures(code.getProcedures())
                .build();
    }
}
