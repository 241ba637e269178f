package com.calexport.indexer.parser;

import java.util.Set;

import com.calexport.indexer.model.ObjectHeader;
import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.model.QueryObject;
import com.calexport.indexer.parser.grammar.CodeSection;

/**
 * Queries. ELEMENTS is required and uses the same data item layout as a report dataset,
 * plus {@code filter(name;source)} calls. CODE is optional.
 */
public class QueryParser extends AbstractObjectParser<QueryObject> {

    private final DataItemSectionParser dataItemParser = new DataItemSectionParser(propertyParser, hierarchyBuilder);

    @Override
    protected Set<ObjectKind> supportedKinds() {
        return Set.of(ObjectKind.QUERY);
    }

    @Override
    protected QueryObject parseBody(ObjectHeader header, String text) {
        DataItemSectionParser.Result elements = dataItemParser.parse(require(text, "ELEMENTS", header));
        CodeSection code = codeSection(text);
        return QueryObject.builder()
                .header(header)
                .properties(objectProperties(text))
                .variables(code.getVariables())
                .procedures(code.getProcedures())
                .dataItems(elements.getRoots())
                .columns(elements.getColumns())
                .filters(elements.getFilters())
                .build();
    }
}
