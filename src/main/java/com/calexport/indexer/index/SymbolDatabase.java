package com.calexport.indexer.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.calexport.indexer.model.CalObject;
import com.calexport.indexer.model.CodeBearingObject;
import com.calexport.indexer.model.Field;
import com.calexport.indexer.model.ObjectKey;
import com.calexport.indexer.model.ObjectKind;
import com.calexport.indexer.model.Procedure;
import com.calexport.indexer.model.TableObject;
import com.calexport.indexer.parser.grammar.TextScanner;

/**
 * In-memory index over parsed objects: by (kind, id), by lower-cased name, by kind, plus
 * fields per table and procedures per owner.
 *
 * <p>Inserting an object whose (kind, id) is already present replaces it everywhere; the
 * object keeps its original position in iteration order.
 *
 * <p>Not thread-safe. One caller owns an instance at a time; a host that shares it between
 * threads has to serialize {@link #insert} and {@link #clear} against all readers itself.
 */
public class SymbolDatabase {
    private static final Logger log = LoggerFactory.getLogger(SymbolDatabase.class);

    public static final int DEFAULT_SUMMARY_PREFIX = 10;

    private final Map<ObjectKey, CalObject> objects = new LinkedHashMap<>();
    private final Map<String, List<CalObject>> byName = new HashMap<>();
    private final Map<ObjectKind, Map<Integer, CalObject>> byKind = new EnumMap<>(ObjectKind.class);
    private final Map<Integer, List<Field>> fieldsByTable = new HashMap<>();
    private final Map<ObjectKey, List<Procedure>> proceduresByOwner = new HashMap<>();

    public void insert(CalObject object) {
        ObjectKey key = object.getKey();
        CalObject previous = objects.get(key);
        if (previous != null) {
            unindex(previous);
            log.debug("Replacing {}", previous.getHeader().describe());
        }
        objects.put(key, object);
        byName.computeIfAbsent(nameKey(object.getName()), k -> new ArrayList<>()).add(object);
        byKind.computeIfAbsent(object.getKind(), k -> new LinkedHashMap<>()).put(object.getId(), object);
        if (object instanceof TableObject table) {
            fieldsByTable.put(table.getId(), table.getFields());
        }
        if (object instanceof CodeBearingObject owner) {
            proceduresByOwner.put(key, owner.getProcedures());
        }
        log.debug("Indexed {}", object.getHeader().describe());
    }

    public void insertAll(Collection<? extends CalObject> batch) {
        batch.forEach(this::insert);
    }

    private void unindex(CalObject object) {
        List<CalObject> sameName = byName.get(nameKey(object.getName()));
        if (sameName != null) {
            sameName.removeIf(o -> o.getKey().equals(object.getKey()));
            if (sameName.isEmpty()) {
                byName.remove(nameKey(object.getName()));
            }
        }
        if (object instanceof TableObject) {
            fieldsByTable.remove(object.getId());
        }
        proceduresByOwner.remove(object.getKey());
    }

    public Optional<CalObject> getById(ObjectKind kind, int id) {
        return Optional.ofNullable(objects.get(ObjectKey.of(kind, id)));
    }

    public Optional<CalObject> getByName(ObjectKind kind, String name) {
        if (name == null) {
            return Optional.empty();
        }
        return byName.getOrDefault(nameKey(name), List.of()).stream()
                .filter(o -> kind == null || o.getKind() == kind)
                .findFirst();
    }

    /**
     * Id when {@code idOrName} is all digits, name otherwise. A digits-only value that is no
     * known id is tried as a name as well.
     */
    public Optional<CalObject> getByIdOrName(ObjectKind kind, String idOrName) {
        if (idOrName == null || idOrName.isBlank()) {
            return Optional.empty();
        }
        String value = idOrName.trim();
        if (value.matches("\\d{1,10}") && kind != null) {
            Integer id = TextScanner.toInt(value);
            Optional<CalObject> byId = id == null ? Optional.empty() : getById(kind, id);
            if (byId.isPresent()) {
                return byId;
            }
        }
        return getByName(kind, value);
    }

    /**
     * Objects whose whole name matches the wildcard pattern, in insertion order, optionally
     * restricted to one kind. {@code offset} is applied before {@code limit}; a non-positive limit
     * means no limit.
     */
    public List<CalObject> search(String pattern, ObjectKind kind, int limit, int offset) {
        Stream<CalObject> matches = matching(pattern, kind).skip(Math.max(0, offset));
        if (limit > 0) {
            matches = matches.limit(limit);
        }
        return matches.toList();
    }

    public List<CalObject> search(String pattern) {
        return search(pattern, null, 0, 0);
    }

    public int count(String pattern, ObjectKind kind) {
        return (int) matching(pattern, kind).count();
    }

    private Stream<CalObject> matching(String pattern, ObjectKind kind) {
        Pattern compiled = SearchPatterns.compile(pattern);
        Collection<CalObject> scope = kind == null
                ? objects.values()
                : byKind.getOrDefault(kind, Map.of()).values();
        return scope.stream().filter(o -> SearchPatterns.matches(compiled, o.getName()));
    }

    public Optional<ObjectSummary> summarize(ObjectKind kind, int id) {
        return summarize(kind, id, DEFAULT_SUMMARY_PREFIX);
    }

    public Optional<ObjectSummary> summarize(ObjectKind kind, int id, int prefixSize) {
        return getById(kind, id).map(object -> {
            List<Field> fields = object instanceof TableObject ? getFields(id) : List.of();
            List<Procedure> procedures = getProcedures(object.getKey());
            return ObjectSummary.builder()
                    .header(object.getHeader())
                    .propertyCount(object.getProperties().size())
                    .fields(fields.subList(0, Math.min(prefixSize, fields.size())))
                    .fieldCount(fields.size())
                    .procedures(procedures.subList(0, Math.min(prefixSize, procedures.size())))
                    .procedureCount(procedures.size())
                    .build();
        });
    }

    public List<Field> getFields(int tableId) {
        return fieldsByTable.getOrDefault(tableId, List.of());
    }

    public List<Procedure> getProcedures(ObjectKey owner) {
        return proceduresByOwner.getOrDefault(owner, List.of());
    }

    public Collection<CalObject> all() {
        return Collections.unmodifiableCollection(objects.values());
    }

    public List<CalObject> all(ObjectKind kind) {
        return List.copyOf(byKind.getOrDefault(kind, Map.of()).values());
    }

    public int size() {
        return objects.size();
    }

    public Map<ObjectKind, Integer> countByKind() {
        Map<ObjectKind, Integer> counts = new EnumMap<>(ObjectKind.class);
        byKind.forEach((kind, members) -> {
            if (!members.isEmpty()) {
                counts.put(kind, members.size());
            }
        });
        return counts;
    }

    public void clear() {
        objects.clear();
        byName.clear();
        byKind.clear();
        fieldsByTable.clear();
        proceduresByOwner.clear();
        log.debug("Symbol database cleared");
    }

    private static String nameKey(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
