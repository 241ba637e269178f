package com.calexport.indexer.query;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.calexport.indexer.model.CalObject;
import com.calexport.indexer.model.CalObjectVisitor;
import com.calexport.indexer.model.CodeBearingObject;
import com.calexport.indexer.model.CodeunitObject;
import com.calexport.indexer.model.Column;
import com.calexport.indexer.model.MenuSuiteObject;
import com.calexport.indexer.model.PageObject;
import com.calexport.indexer.model.Procedure;
import com.calexport.indexer.model.QueryObject;
import com.calexport.indexer.model.ReportObject;
import com.calexport.indexer.model.TableObject;
import com.calexport.indexer.model.Variable;
import com.calexport.indexer.model.XmlPortObject;

/**
 * Lists the members of an object by category. The categories present depend on the kind;
 * a category with no entries is still listed when the kind supports it.
 */
public class MemberCatalog implements CalObjectVisitor<Map<MemberCategory, List<Member>>> {

    public Map<MemberCategory, List<Member>> catalog(CalObject object) {
        return object.accept(this);
    }

    @Override
    public Map<MemberCategory, List<Member>> visitTable(TableObject table) {
        Map<MemberCategory, List<Member>> members = new LinkedHashMap<>();
        members.put(MemberCategory.FIELDS, table.getFields().stream()
                .map(f -> Member.builder()
                        .category(MemberCategory.FIELDS)
                        .id(f.getId())
                        .name(f.getName())
                        .type(f.getDataType())
                        .detail(f.getFieldClass())
                        .build())
                .toList());
        members.put(MemberCategory.KEYS, table.getKeys().stream()
                .map(k -> Member.builder()
                        .category(MemberCategory.KEYS)
                        .name(k.describe())
                        .detail(k.isClustered() ? "Clustered" : null)
                        .build())
                .toList());
        members.put(MemberCategory.FIELD_GROUPS, table.getFieldGroups().stream()
                .map(g -> Member.builder()
                        .category(MemberCategory.FIELD_GROUPS)
                        .id(g.getId())
                        .name(g.getName())
                        .detail(String.join(",", g.getFields()))
                        .build())
                .toList());
        code(table, members);
        return members;
    }

    @Override
    public Map<MemberCategory, List<Member>> visitPage(PageObject page) {
        Map<MemberCategory, List<Member>> members = new LinkedHashMap<>();
        members.put(MemberCategory.CONTROLS, page.getAllControls().stream()
                .map(c -> Member.builder()
                        .category(MemberCategory.CONTROLS)
                        .id(c.getId())
                        .name(c.getDisplayName())
                        .type(c.getType())
                        .level(c.getLevel())
                        .detail(c.getSourceExpr())
                        .build())
                .toList());
        members.put(MemberCategory.ACTIONS, page.getActions().stream()
                .map(a -> Member.builder()
                        .category(MemberCategory.ACTIONS)
                        .id(a.getId())
                        .name(a.getDisplayName())
                        .type(a.getType())
                        .level(a.getLevel())
                        .detail(a.runObject().map(Object::toString).orElse(null))
                        .build())
                .toList());
        code(page, members);
        return members;
    }

    @Override
    public Map<MemberCategory, List<Member>> visitCodeunit(CodeunitObject codeunit) {
        Map<MemberCategory, List<Member>> members = new LinkedHashMap<>();
        code(codeunit, members);
        return members;
    }

    @Override
    public Map<MemberCategory, List<Member>> visitReport(ReportObject report) {
        Map<MemberCategory, List<Member>> members = new LinkedHashMap<>();
        members.put(MemberCategory.DATA_ITEMS, report.getAllDataItems().stream()
                .map(d -> Member.builder()
                        .category(MemberCategory.DATA_ITEMS)
                        .name(d.getName())
                        .type(d.getTableName())
                        .id(d.getTableId())
                        .level(d.getLevel())
                        .build())
                .toList());
        members.put(MemberCategory.COLUMNS, columns(MemberCategory.COLUMNS, report.getColumns()));
        code(report, members);
        return members;
    }

    @Override
    public Map<MemberCategory, List<Member>> visitQuery(QueryObject query) {
        Map<MemberCategory, List<Member>> members = new LinkedHashMap<>();
        members.put(MemberCategory.DATA_ITEMS, query.getAllDataItems().stream()
                .map(d -> Member.builder()
                        .category(MemberCategory.DATA_ITEMS)
                        .name(d.getName())
                        .type(d.getTableName())
                        .id(d.getTableId())
                        .level(d.getLevel())
                        .build())
                .toList());
        members.put(MemberCategory.COLUMNS, columns(MemberCategory.COLUMNS, query.getColumns()));
        members.put(MemberCategory.FILTERS, columns(MemberCategory.FILTERS, query.getFilters()));
        code(query, members);
        return members;
    }

    @Override
    public Map<MemberCategory, List<Member>> visitXmlPort(XmlPortObject xmlPort) {
        Map<MemberCategory, List<Member>> members = new LinkedHashMap<>();
        members.put(MemberCategory.NODES, xmlPort.getAllNodes().stream()
                .map(n -> Member.builder()
                        .category(MemberCategory.NODES)
                        .name(n.getName())
                        .type(n.getNodeType().getToken())
                        .level(n.getLevel())
                        .detail(n.getSourceField() != null ? n.getSourceField() : n.getSourceTable())
                        .build())
                .toList());
        code(xmlPort, members);
        return members;
    }

    @Override
    public Map<MemberCategory, List<Member>> visitMenuSuite(MenuSuiteObject menuSuite) {
        Map<MemberCategory, List<Member>> members = new LinkedHashMap<>();
        members.put(MemberCategory.MENU_ITEMS, menuSuite.getAllMenuItems().stream()
                .map(m -> Member.builder()
                        .category(MemberCategory.MENU_ITEMS)
                        .id(m.getId())
                        .name(m.getName())
                        .type(m.isSeparator() ? "Separator" : m.isFolder() ? "Folder" : "Item")
                        .level(m.getLevel())
                        .detail(m.runObject().map(Object::toString).orElse(null))
                        .build())
                .toList());
        return members;
    }

    private static void code(CodeBearingObject object, Map<MemberCategory, List<Member>> members) {
        members.put(MemberCategory.PROCEDURES, object.getProcedures().stream()
                .map(MemberCatalog::procedure)
                .toList());
        members.put(MemberCategory.VARIABLES, object.getVariables().stream()
                .map(MemberCatalog::variable)
                .toList());
    }

    private static Member procedure(Procedure p) {
        return Member.builder()
                .category(MemberCategory.PROCEDURES)
                .id(p.getId())
                .name(p.getName())
                .type(p.getSignature())
                .detail(p.isLocal() ? "Local" : null)
                .build();
    }

    private static Member variable(Variable v) {
        return Member.builder()
                .category(MemberCategory.VARIABLES)
                .id(v.getId())
                .name(v.getName())
                .type(v.getDeclaredType())
                .build();
    }

    private static List<Member> columns(MemberCategory category, List<Column> columns) {
        return columns.stream()
                .map(c -> Member.builder()
                        .category(category)
                        .name(c.getName())
                        .type(c.getSourceExpr())
                        .detail(c.getDataItemName())
                        .build())
                .toList();
    }
}
