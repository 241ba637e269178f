package com.calexport.indexer.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calexport.indexer.index.ObjectSummary;
import com.calexport.indexer.index.SearchPatterns;
import com.calexport.indexer.index.SymbolDatabase;
import com.calexport.indexer.loader.LoadResult;
import com.calexport.indexer.model.CalObject;
import com.calexport.indexer.model.ObjectKey;
import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.model.Procedure;
import com.calexport.indexer.reference.Reference;
import com.calexport.indexer.reference.ReferenceExtractor;
import com.calexport.indexer.reference.ReferenceType;

import lombok.RequiredArgsConstructor;

/**
 * Read-side operations over an {@link IndexContext}. Arguments arrive as loosely typed values
 * (kind names, ids as text, optional paging) and are validated here; every operation answers
 * with a {@link QueryResult} instead of throwing.
 */
@RequiredArgsConstructor
public class IndexQueryService {
    private static final Logger log = LoggerFactory.getLogger(IndexQueryService.class);

    private final IndexContext context;
    private final ReferenceExtractor referenceExtractor;
    private final MemberCatalog memberCatalog;

    public IndexQueryService(IndexContext context) {
        this(context, new ReferenceExtractor(), new MemberCatalog());
    }

    public QueryResult<PagedResult<CalObject>> searchObjects(String pattern, String kind, Integer limit, Integer offset) {
        Optional<String> invalid = checkKind(kind).or(() -> checkPaging(limit, offset));
        if (invalid.isPresent()) {
            return QueryResult.invalidArgument(invalid.get());
        }
        ObjectKind scope = ObjectKind.parse(kind).orElse(null);
        SymbolDatabase db = database();
        int start = offset == null ? 0 : offset;
        int size = limit(limit);
        List<CalObject> page = db.search(pattern, scope, size, start);
        return QueryResult.ok(new PagedResult<>(page, db.count(pattern, scope), start, size));
    }

    public QueryResult<CalObject> getObject(String kind, String idOrName) {
        if (ObjectKind.parse(kind).isEmpty()) {
            return QueryResult.invalidArgument("Unknown object kind: " + kind);
        }
        if (idOrName == null || idOrName.isBlank()) {
            return QueryResult.invalidArgument("Object id or name is required");
        }
        ObjectKind objectKind = ObjectKind.parse(kind).get();
        return database().getByIdOrName(objectKind, idOrName)
                .map(QueryResult::ok)
                .orElseGet(() -> QueryResult.notFound(objectKind + " '" + idOrName.trim() + "' is not loaded"));
    }

    public QueryResult<PagedResult<Member>> getMembers(String objectName, String kind, String category,
                                                       String pattern, Integer limit, Integer offset) {
        Optional<String> invalid = checkKind(kind).or(() -> checkPaging(limit, offset));
        if (invalid.isPresent()) {
            return QueryResult.invalidArgument(invalid.get());
        }
        Optional<MemberCategory> memberCategory = MemberCategory.parse(category);
        if (memberCategory.isEmpty()) {
            return QueryResult.invalidArgument("Unknown member category: " + category);
        }
        QueryResult<CalObject> owner = owner(objectName, kind);
        if (!owner.isOk()) {
            return owner.map(o -> null);
        }
        CalObject object = owner.getValue();
        Map<MemberCategory, List<Member>> members = memberCatalog.catalog(object);
        if (!members.containsKey(memberCategory.get())) {
            return QueryResult.invalidArgument(object.getKind() + " objects have no " + memberCategory.get());
        }
        Pattern compiled = SearchPatterns.compile(pattern);
        List<Member> matching = members.get(memberCategory.get()).stream()
                .filter(m -> SearchPatterns.matches(compiled, m.getName()))
                .toList();
        return QueryResult.ok(PagedResult.slice(matching, offset == null ? 0 : offset, limit(limit)));
    }

    public QueryResult<CategorizedSummary> getSummary(String objectName, String kind) {
        Optional<String> invalid = checkKind(kind);
        if (invalid.isPresent()) {
            return QueryResult.invalidArgument(invalid.get());
        }
        QueryResult<CalObject> owner = owner(objectName, kind);
        if (!owner.isOk()) {
            return owner.map(o -> null);
        }
        CalObject object = owner.getValue();
        ObjectSummary summary = database()
                .summarize(object.getKind(), object.getId(), context.getConfig().getSummaryPrefixSize())
                .orElseThrow();
        CategorizedSummary.CategorizedSummaryBuilder builder = CategorizedSummary.builder().summary(summary);
        memberCatalog.catalog(object).forEach((category, members) -> builder.memberCount(category, members.size()));
        procedureGroups(database().getProcedures(object.getKey())).forEach(builder::procedureGroup);
        return QueryResult.ok(builder.build());
    }

    public QueryResult<PagedResult<Reference>> findReferences(String targetName, String fieldName, String referenceType,
                                                              Integer limit, Integer offset) {
        if (targetName == null || targetName.isBlank()) {
            return QueryResult.invalidArgument("Target name is required");
        }
        Optional<String> invalid = checkPaging(limit, offset);
        if (invalid.isPresent()) {
            return QueryResult.invalidArgument(invalid.get());
        }
        Optional<ReferenceType> type = ReferenceType.parse(referenceType);
        if (referenceType != null && !referenceType.isBlank() && type.isEmpty()) {
            return QueryResult.invalidArgument("Unknown reference type: " + referenceType);
        }
        String target = targetName.trim();
        List<CalObject> targets = database().all().stream()
                .filter(o -> o.getName().equalsIgnoreCase(target))
                .toList();
        List<Reference> matches = referenceExtractor.extractAll(database().all()).stream()
                .filter(r -> pointsAt(r, target, targets))
                .filter(r -> fieldName == null || fieldName.isBlank()
                        || r.targetField().filter(f -> f.equalsIgnoreCase(fieldName.trim())).isPresent())
                .filter(r -> type.isEmpty() || r.getReferenceType() == type.get())
                .toList();
        log.debug("{} reference(s) to '{}'", matches.size(), target);
        return QueryResult.ok(PagedResult.slice(matches, offset == null ? 0 : offset, limit(limit)));
    }

    public QueryResult<DependencyGraph> getDependencies(String kind, String idOrName, String direction) {
        Optional<Direction> dir = Direction.parse(direction);
        if (dir.isEmpty()) {
            return QueryResult.invalidArgument("Direction must be incoming, outgoing or both: " + direction);
        }
        QueryResult<CalObject> found = getObject(kind, idOrName);
        if (!found.isOk()) {
            return found.map(o -> null);
        }
        CalObject object = found.getValue();
        DependencyGraph.DependencyGraphBuilder graph = DependencyGraph.builder()
                .object(object.getHeader())
                .direction(dir.get());
        if (dir.get().includesOutgoing()) {
            graph.outgoing(referenceExtractor.extract(object));
        } else {
            graph.outgoing(List.of());
        }
        List<Reference> incoming = new ArrayList<>();
        if (dir.get().includesIncoming()) {
            for (CalObject other : database().all()) {
                if (other.getKey().equals(object.getKey())) {
                    continue;
                }
                referenceExtractor.extract(other).stream()
                        .filter(r -> targets(r, object))
                        .forEach(incoming::add);
            }
        }
        graph.incoming(incoming);
        return QueryResult.ok(graph.build());
    }

    /**
     * TableRelation edges of all tables, or of one table, optionally with CalcFormula edges.
     * Relations originate in tables only, so {@code kind} may be omitted or must name Table.
     */
    public QueryResult<List<Reference>> getTableRelations(String kind, Integer tableId, boolean includeCalcFormula) {
        if (kind != null && !kind.isBlank() && ObjectKind.parse(kind).filter(k -> k == ObjectKind.TABLE).isEmpty()) {
            return QueryResult.invalidArgument("Relations are only recorded on tables, not on " + kind);
        }
        List<CalObject> tables;
        if (tableId != null) {
            Optional<CalObject> table = database().getById(ObjectKind.TABLE, tableId);
            if (table.isEmpty()) {
                return QueryResult.notFound("Table " + tableId + " is not loaded");
            }
            tables = List.of(table.get());
        } else {
            tables = database().all(ObjectKind.TABLE);
        }
        List<Reference> relations = referenceExtractor.extractAll(tables).stream()
                .filter(r -> r.getReferenceType() == ReferenceType.TABLE_RELATION
                        || (includeCalcFormula && r.getReferenceType() == ReferenceType.CALC_FORMULA))
                .toList();
        return QueryResult.ok(relations);
    }

    /**
     * Every procedure body line matching {@code regex} (case-insensitive), in index order.
     */
    public QueryResult<List<CodeMatch>> searchCode(String regex, String kind, Integer limit) {
        if (regex == null || regex.isEmpty()) {
            return QueryResult.invalidArgument("Search pattern is required");
        }
        Optional<String> invalid = checkKind(kind).or(() -> checkPaging(limit, null));
        if (invalid.isPresent()) {
            return QueryResult.invalidArgument(invalid.get());
        }
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            return QueryResult.invalidArgument("Invalid search pattern: " + e.getDescription());
        }
        ObjectKind scope = ObjectKind.parse(kind).orElse(null);
        int max = limit(limit);
        List<CodeMatch> matches = new ArrayList<>();
        for (CalObject object : scope == null ? List.copyOf(database().all()) : database().all(scope)) {
            for (Procedure procedure : database().getProcedures(object.getKey())) {
                List<String> lines = procedure.getBodyLines();
                for (int i = 0; i < lines.size(); i++) {
                    if (!pattern.matcher(lines.get(i)).find()) {
                        continue;
                    }
                    matches.add(CodeMatch.builder()
                            .objectKind(object.getKind())
                            .objectId(object.getId())
                            .objectName(object.getName())
                            .procedureName(procedure.getName())
                            .lineNumber(i + 1)
                            .line(lines.get(i).trim())
                            .build());
                    if (matches.size() >= max) {
                        return QueryResult.ok(matches);
                    }
                }
            }
        }
        return QueryResult.ok(matches);
    }

    public List<LoadResult> getLoadedFiles() {
        return context.getLoadResults();
    }

    public IndexStatistics getStatistics() {
        SymbolDatabase db = database();
        return IndexStatistics.builder()
                .totalObjects(db.size())
                .objectsByKind(db.countByKind())
                .sources(context.getLoadedSources())
                .failedObjects(context.getLoadResults().stream().mapToInt(r -> r.getFailures().size()).sum())
                .totalBytes(context.getLoadResults().stream().mapToLong(LoadResult::getBytes).sum())
                .build();
    }

    private QueryResult<CalObject> owner(String objectName, String kind) {
        if (objectName == null || objectName.isBlank()) {
            return QueryResult.invalidArgument("Object name is required");
        }
        ObjectKind scope = ObjectKind.parse(kind).orElse(null);
        return database().getByIdOrName(scope, objectName)
                .map(QueryResult::ok)
                .orElseGet(() -> QueryResult.notFound("Object '" + objectName.trim() + "' is not loaded"));
    }

    private static boolean pointsAt(Reference reference, String targetName, List<CalObject> targets) {
        if (reference.getTargetName().equalsIgnoreCase(targetName)) {
            return true;
        }
        return reference.targetKey().filter(key -> targets.stream().anyMatch(t -> t.getKey().equals(key))).isPresent();
    }

    /** An edge with a target id must match the key, one without must match kind and name. */
    private static boolean targets(Reference reference, CalObject object) {
        Optional<ObjectKey> key = reference.targetKey();
        if (key.isPresent()) {
            return key.get().equals(object.getKey());
        }
        return reference.getTargetKind() == object.getKind()
                && object.getName().equalsIgnoreCase(reference.getTargetName());
    }

    private static Map<String, List<String>> procedureGroups(List<Procedure> procedures) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (Procedure p : procedures) {
            String group;
            if (p.isEventSubscriber()) {
                group = "Event subscribers";
            } else if (p.isExternal()) {
                group = "External";
            } else if (p.isLocal()) {
                group = "Local";
            } else {
                group = "Global";
            }
            groups.computeIfAbsent(group, g -> new ArrayList<>()).add(p.getName());
        }
        return groups;
    }

    private int limit(Integer limit) {
        return limit == null ? context.getConfig().getDefaultLimit() : limit;
    }

    private static Optional<String> checkKind(String kind) {
        if (kind != null && !kind.isBlank() && ObjectKind.parse(kind).isEmpty()) {
            return Optional.of("Unknown object kind: " + kind);
        }
        return Optional.empty();
    }

    private static Optional<String> checkPaging(Integer limit, Integer offset) {
        if (limit != null && limit < 1) {
            return Optional.of("Limit must be positive: " + limit);
        }
        if (offset != null && offset < 0) {
            return Optional.of("Offset must not be negative: " + offset);
        }
        return Optional.empty();
    }

    private SymbolDatabase database() {
        return context.getDatabase();
    }
}
