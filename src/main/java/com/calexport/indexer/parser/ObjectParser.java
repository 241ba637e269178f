package com.calexport.indexer.parser;

import com.calexport.indexer.model.CalObject;
import com.calexport.indexer.model.ObjectHeader;

/**
 * Entry point for a single object's text: reads the declaration and hands the text to the
 * body parser for its kind.
 */
public class ObjectParser {

    private final ObjectDeclarationParser declarationParser = new ObjectDeclarationParser();
    private final TableParser tableParser = new TableParser();
    private final PageParser pageParser = new PageParser();
    private final CodeunitParser codeunitParser = new CodeunitParser();
    private final ReportParser reportParser = new ReportParser();
    private final QueryParser queryParser = new QueryParser();
    private final XmlPortParser xmlPortParser = new XmlPortParser();
    private final MenuSuiteParser menuSuiteParser = new MenuSuiteParser();

    public CalObject parse(String objectText) {
        ObjectHeader header = declarationParser.parse(objectText);
        return switch (header.getKind()) {
            case TABLE -> tableParser.parse(objectText);
            case PAGE, FORM -> pageParser.parse(objectText);
            case CODEUNIT -> codeunitParser.parse(objectText);
            case REPORT -> reportParser.parse(objectText);
            case QUERY -> queryParser.parse(objectText);
            case XMLPORT -> xmlPortParser.parse(objectText);
            case MENUSUITE -> menuSuiteParser.parse(objectText);
        };
    }
}
