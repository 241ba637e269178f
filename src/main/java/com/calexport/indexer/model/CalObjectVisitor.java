package com.calexport.indexer.model;

/**
 * Exhaustive dispatch over the object kinds. Forms are represented by {@link PageObject}.
 */
public interface CalObjectVisitor<R> {
    R visitTable(TableObject table);

    R visitPage(PageObject page);

    R visitCodeunit(CodeunitObject codeunit);

    R visitReport(ReportObject report);

    R visitQuery(QueryObject query);

    R visitXmlPort(XmlPortObject xmlPort);

    R visitMenuSuite(MenuSuiteObject menuSuite);
}
