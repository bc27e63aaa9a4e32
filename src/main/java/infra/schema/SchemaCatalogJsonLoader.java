package infra.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import domain.model.InvalidEvaluationInputException;
import domain.schema.ForeignKey;
import domain.schema.SchemaCatalog;
import domain.schema.SchemaColumn;
import domain.schema.SchemaRecord;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a schema catalog document ({@code tables.json} layout): a JSON array of records with
 * {@code db_id}, {@code table_names}, {@code column_names} ({@code [table_index, name]} pairs),
 * {@code column_types}, {@code foreign_keys} and {@code primary_keys}.
 *
 * <p>{@code *_original} name lists are used when the plain ones are missing. Primary keys may be
 * nested (composite keys as inner arrays); they are flattened.</p>
 */
public final class SchemaCatalogJsonLoader {

    private static final Logger log = LoggerFactory.getLogger(SchemaCatalogJsonLoader.class);

    private final ObjectMapper mapper;

    public SchemaCatalogJsonLoader() {
        this(new ObjectMapper());
    }

    public SchemaCatalogJsonLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public SchemaCatalog load(Path path) {
        if (path == null) throw new IllegalArgumentException("schema catalog path is null");
        if (!Files.exists(path)) throw new IllegalArgumentException("schema catalog not found: " + path);

        try (InputStream is = Files.newInputStream(path)) {
            SchemaCatalog catalog = load(is);
            log.info("[LOAD] schema catalog: {} databases from {}", catalog.size(), path);
            return catalog;
        } catch (IOException e) {
            throw new IllegalStateException("failed to read schema catalog: " + path, e);
        }
    }

    public SchemaCatalog load(InputStream in) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (IOException e) {
            throw new InvalidEvaluationInputException("schema catalog is not valid JSON", e);
        }
        if (root == null || !root.isArray()) {
            throw new InvalidEvaluationInputException("schema catalog must be a JSON array of schema records");
        }

        List<SchemaRecord> records = new ArrayList<>(root.size());
        for (JsonNode n : root) {
            records.add(toRecord(n));
        }
        return new SchemaCatalog(records);
    }

    static SchemaRecord toRecord(JsonNode n) {
        String dbId = n.path("db_id").asText("");
        List<String> tables = strings(first(n, "table_names", "table_names_original"));

        JsonNode cols = first(n, "column_names", "column_names_original");
        JsonNode types = n.path("column_types");
        List<SchemaColumn> columns = new ArrayList<>(cols.size());
        int i = 0;
        for (JsonNode c : cols) {
            if (!c.isArray() || c.size() < 2) {
                throw new InvalidEvaluationInputException("schema '" + dbId + "': column " + i
                        + " is not a [table_index, column_name] pair");
            }
            String type = types.has(i) ? types.get(i).asText("") : "";
            columns.add(new SchemaColumn(c.get(0).asInt(), c.get(1).asText(""), type));
            i++;
        }

        List<ForeignKey> fks = new ArrayList<>();
        for (JsonNode fk : n.path("foreign_keys")) {
            if (fk.isArray() && fk.size() >= 2) fks.add(new ForeignKey(fk.get(0).asInt(), fk.get(1).asInt()));
        }

        List<Integer> pks = new ArrayList<>();
        flattenInts(n.path("primary_keys"), pks);

        return new SchemaRecord(dbId, tables, columns, fks, pks);
    }

    private static JsonNode first(JsonNode n, String... fields) {
        for (String f : fields) {
            JsonNode v = n.get(f);
            if (v != null && v.isArray()) return v;
        }
        return n.path(fields[0]);
    }

    private static List<String> strings(JsonNode arr) {
        List<String> out = new ArrayList<>(arr.size());
        for (JsonNode t : arr) out.add(t.asText(""));
        return out;
    }

    private static void flattenInts(JsonNode n, List<Integer> out) {
        if (n == null || n.isMissingNode() || n.isNull()) return;
        if (n.isArray()) {
            for (JsonNode c : n) flattenInts(c, out);
            return;
        }
        if (n.canConvertToInt()) out.add(n.asInt());
    }
}
