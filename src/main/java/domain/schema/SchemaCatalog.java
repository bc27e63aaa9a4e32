package domain.schema;

import domain.model.InvalidEvaluationInputException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-only catalog of schema records keyed by db_id.
 *
 * <p>Loaded once and shared by every comparison. Binders are built lazily per db_id and
 * cached; the catalog is static for a dataset version, so entries are never invalidated.</p>
 */
public final class SchemaCatalog {

    private static final SchemaCatalog EMPTY = new SchemaCatalog(List.of());

    private final Map<String, SchemaRecord> byDbId;
    private final Map<String, SchemaBinder> binders = new ConcurrentHashMap<>();

    public SchemaCatalog(Collection<SchemaRecord> records) {
        Map<String, SchemaRecord> m = new LinkedHashMap<>();
        if (records != null) {
            for (SchemaRecord r : records) {
                if (r == null) continue;
                if (m.putIfAbsent(r.getDbId(), r) != null) {
                    throw new InvalidEvaluationInputException("duplicate db_id in schema catalog: " + r.getDbId());
                }
            }
        }
        this.byDbId = Collections.unmodifiableMap(m);
    }

    public static SchemaCatalog empty() {
        return EMPTY;
    }

    /** @return record for db_id, or null */
    public SchemaRecord find(String dbId) {
        if (dbId == null) return null;
        return byDbId.get(dbId.trim());
    }

    /** @return cached binder for db_id, or null when the db_id is unknown */
    public SchemaBinder binderFor(String dbId) {
        SchemaRecord r = find(dbId);
        if (r == null) return null;
        return binders.computeIfAbsent(r.getDbId(), k -> new SchemaBinder(r));
    }

    public boolean contains(String dbId) {
        return find(dbId) != null;
    }

    public int size() {
        return byDbId.size();
    }

    public Collection<SchemaRecord> records() {
        return byDbId.values();
    }
}
