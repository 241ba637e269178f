package com.calexport.indexer.reference;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.calexport.indexer.model.CalObject;
import com.calexport.indexer.model.CalObjectVisitor;
import com.calexport.indexer.model.CodeBearingObject;
import com.calexport.indexer.model.CodeunitObject;
import com.calexport.indexer.model.Control;
import com.calexport.indexer.model.DataItem;
import com.calexport.indexer.model.Field;
import com.calexport.indexer.model.MenuItem;
import com.calexport.indexer.model.MenuSuiteObject;
import com.calexport.indexer.model.ObjectKey;
import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.model.PageAction;
import com.calexport.indexer.model.PageObject;
import com.calexport.indexer.model.Parameter;
import com.calexport.indexer.model.PortNode;
import com.calexport.indexer.model.Procedure;
import com.calexport.indexer.model.QueryObject;
import com.calexport.indexer.model.ReportObject;
import com.calexport.indexer.model.TableObject;
import com.calexport.indexer.model.Variable;
import com.calexport.indexer.model.XmlPortObject;
import com.calexport.indexer.parser.grammar.AggregateFormulaParser;
import com.calexport.indexer.parser.grammar.RelationConstraintParser;
import com.calexport.indexer.parser.grammar.TextScanner;
import com.calexport.indexer.parser.grammar.VariableDeclarationParser;

/**
 * Mines an object for edges to other objects: table relations and calc formulas of fields,
 * object-typed variables and parameters, bound tables of pages, data items and XMLport nodes,
 * and RunObject/PagePartID targets.
 *
 * Never throws; expressions that cannot be read produce no edge.
 */
public class ReferenceExtractor {

    private static final Pattern PAGE_PART = Pattern.compile("^(?:Page)?\\s*(\\d{1,10})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TABLE_ID = Pattern.compile("^(?:Table)?\\s*(\\d{1,10})$", Pattern.CASE_INSENSITIVE);

    private final RelationConstraintParser relationParser = new RelationConstraintParser();
    private final AggregateFormulaParser formulaParser = new AggregateFormulaParser();
    private final VariableDeclarationParser variableParser = new VariableDeclarationParser();

    public List<Reference> extract(CalObject object) {
        Collector collector = new Collector(object);
        object.accept(collector);
        return List.copyOf(collector.references);
    }

    public List<Reference> extractAll(Iterable<? extends CalObject> objects) {
        List<Reference> all = new ArrayList<>();
        for (CalObject object : objects) {
            all.addAll(extract(object));
        }
        return all;
    }

    private class Collector implements CalObjectVisitor<Void> {
        private final CalObject source;
        private final List<Reference> references = new ArrayList<>();

        Collector(CalObject source) {
            this.source = source;
        }

        @Override
        public Void visitTable(TableObject table) {
            for (Field field : table.getFields()) {
                String location = "Field:" + field.getName();
                relationParser.parse(field.getTableRelation()).ifPresent(relation ->
                        add(location, ObjectKind.TABLE, null, relation.getTargetName(), relation.getFieldName(),
                                ReferenceType.TABLE_RELATION));
                formulaParser.parse(field.getCalcFormula()).ifPresent(formula ->
                        add(location, ObjectKind.TABLE, null, formula.getTargetName(), formula.getFieldName(),
                                ReferenceType.CALC_FORMULA));
            }
            table.lookupPageId().ifPresent(id ->
                    add("Property:LookupPageID", ObjectKind.PAGE, id, null, null, ReferenceType.RUN_OBJECT));
            table.drillDownPageId().ifPresent(id ->
                    add("Property:DrillDownPageID", ObjectKind.PAGE, id, null, null, ReferenceType.RUN_OBJECT));
            code(table);
            return null;
        }

        @Override
        public Void visitPage(PageObject page) {
            Integer tableId = page.getSourceTableId();
            String tableName = page.propertyValue("SourceTable")
                    .filter(v -> !TABLE_ID.matcher(v.trim()).matches())
                    .map(TextScanner::unquote)
                    .orElse(null);
            if (tableId != null || tableName != null) {
                add("Property:SourceTable", ObjectKind.TABLE, tableId, tableName, null, ReferenceType.SOURCE_TABLE);
            }
            for (Control control : page.getAllControls()) {
                control.propertyValue("PagePartID").ifPresent(value -> {
                    Matcher m = PAGE_PART.matcher(value.trim());
                    if (m.matches()) {
                        add("Control:" + control.getDisplayName(), ObjectKind.PAGE, TextScanner.toInt(m.group(1)),
                                null, null, ReferenceType.PAGE_PART);
                    }
                });
            }
            for (PageAction action : page.getActions()) {
                action.runObject().ifPresent(target ->
                        runObject("Action:" + action.getDisplayName(), target));
            }
            code(page);
            return null;
        }

        @Override
        public Void visitCodeunit(CodeunitObject codeunit) {
            code(codeunit);
            return null;
        }

        @Override
        public Void visitReport(ReportObject report) {
            dataItems(report.getAllDataItems());
            code(report);
            return null;
        }

        @Override
        public Void visitQuery(QueryObject query) {
            dataItems(query.getAllDataItems());
            code(query);
            return null;
        }

        @Override
        public Void visitXmlPort(XmlPortObject xmlPort) {
            for (PortNode node : xmlPort.getAllNodes()) {
                if (node.getSourceTableId() != null) {
                    add("Node:" + node.getName(), ObjectKind.TABLE, node.getSourceTableId(), null, null,
                            ReferenceType.SOURCE_TABLE);
                } else if (node.getSourceTable() != null && !node.getSourceTable().isBlank()) {
                    add("Node:" + node.getName(), ObjectKind.TABLE, null, TextScanner.unquote(node.getSourceTable()),
                            null, ReferenceType.SOURCE_TABLE);
                }
            }
            code(xmlPort);
            return null;
        }

        @Override
        public Void visitMenuSuite(MenuSuiteObject menuSuite) {
            for (MenuItem item : menuSuite.getAllMenuItems()) {
                item.runObject().ifPresent(target -> runObject("MenuItem:" + item.getName(), target));
            }
            return null;
        }

        private void dataItems(List<DataItem> items) {
            for (DataItem item : items) {
                if (item.getTableId() != null || item.getTableName() != null) {
                    add("DataItem:" + item.getName(), ObjectKind.TABLE, item.getTableId(), item.getTableName(), null,
                            ReferenceType.DATA_ITEM_TABLE);
                }
            }
        }

        private void code(CodeBearingObject object) {
            for (Variable variable : object.getVariables()) {
                variable("Variable:" + variable.getName(), variable);
            }
            for (Procedure procedure : object.getProcedures()) {
                String prefix = "Procedure:" + procedure.getName() + "/";
                for (Parameter parameter : procedure.getParameters()) {
                    if (parameter.getType() == null) {
                        continue;
                    }
                    Variable typed = variableParser.parseType(parameter.getName(), parameter.getId(), parameter.getType());
                    variable(prefix + "Parameter:" + parameter.getName(), typed);
                }
                for (Variable local : procedure.getLocalVariables()) {
                    variable(prefix + "Variable:" + local.getName(), local);
                }
            }
        }

        private void variable(String location, Variable variable) {
            variable.referencedKind().ifPresent(kind -> add(location, kind, variable.getObjectId(),
                    variable.getObjectName(), null,
                    kind == ObjectKind.TABLE ? ReferenceType.RECORD_VARIABLE : ReferenceType.OBJECT_VARIABLE));
        }

        private void runObject(String location, ObjectKey target) {
            add(location, target.getKind(), target.getId(), null, null, ReferenceType.RUN_OBJECT);
        }

        private void add(String location, ObjectKind targetKind, Integer targetId, String targetName,
                         String targetField, ReferenceType type) {
            String name = targetName != null && !targetName.isBlank() ? targetName : null;
            if (name == null && targetId == null) {
                return;
            }
            references.add(Reference.builder()
                    .sourceKind(source.getKind())
                    .sourceId(source.getId())
                    .sourceName(source.getName())
                    .sourceLocation(location)
                    .targetKind(targetKind)
                    .targetId(targetId)
                    .targetName(name != null ? name : String.valueOf(targetId))
                    .targetField(targetField)
                    .referenceType(type)
                    .build());
        }
    }
}
