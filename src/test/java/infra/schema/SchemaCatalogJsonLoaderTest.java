package infra.schema;

import domain.model.InvalidEvaluationInputException;
import domain.schema.SchemaBinder;
import domain.schema.SchemaCatalog;
import domain.schema.SchemaRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SchemaCatalogJsonLoaderTest {

    @TempDir
    Path tempDir;

    private static final String TABLES_JSON = "[\n"
            + "  {\n"
            + "    \"db_id\": \"school\",\n"
            + "    \"table_names\": [\"hoc sinh\", \"lop\"],\n"
            + "    \"table_names_original\": [\"hoc_sinh\", \"lop\"],\n"
            + "    \"column_names\": [[-1, \"*\"], [0, \"ten hoc sinh\"], [0, \"lop id\"], [1, \"lop id\"]],\n"
            + "    \"column_names_original\": [[-1, \"*\"], [0, \"ten_hoc_sinh\"], [0, \"lop_id\"], [1, \"lop_id\"]],\n"
            + "    \"column_types\": [\"text\", \"text\", \"number\", \"number\"],\n"
            + "    \"foreign_keys\": [[2, 3]],\n"
            + "    \"primary_keys\": [3, [1, 2]]\n"
            + "  },\n"
            + "  {\n"
            + "    \"db_id\": \"shop\",\n"
            + "    \"table_names_original\": [\"item\"],\n"
            + "    \"column_names_original\": [[0, \"price\"]]\n"
            + "  }\n"
            + "]";

    @Test
    void load_shouldReadRecordsAndFlattenPrimaryKeys() throws Exception {
        Path file = tempDir.resolve("tables.json");
        Files.writeString(file, TABLES_JSON);

        SchemaCatalog catalog = new SchemaCatalogJsonLoader().load(file);

        assertEquals(2, catalog.size());
        SchemaRecord school = catalog.find("school");
        assertEquals(List.of("hoc sinh", "lop"), school.getTableNames());
        assertEquals(4, school.getColumns().size());
        assertEquals("number", school.getColumns().get(2).type);
        assertEquals(List.of(3, 1, 2), school.getPrimaryKeys());
        assertEquals(1, school.getForeignKeys().size());

        SchemaBinder binder = catalog.binderFor("school");
        assertTrue(binder.isAmbiguousColumn("lop_id"));
        assertEquals("hoc sinh.ten hoc sinh", binder.resolve(null, "ten_hoc_sinh", Set.of()));
    }

    @Test
    void load_shouldFallBackToOriginalNames() throws Exception {
        SchemaCatalog catalog = new SchemaCatalogJsonLoader().load(
                new ByteArrayInputStream(TABLES_JSON.getBytes(StandardCharsets.UTF_8)));

        SchemaRecord shop = catalog.find("shop");
        assertEquals(List.of("item"), shop.getTableNames());
        assertEquals("price", shop.getColumns().get(0).name);
        assertEquals("", shop.getColumns().get(0).type);
    }

    @Test
    void load_shouldRejectMalformedDocuments() {
        SchemaCatalogJsonLoader loader = new SchemaCatalogJsonLoader();

        assertThrows(InvalidEvaluationInputException.class,
                () -> loader.load(new ByteArrayInputStream("{\"db_id\": \"x\"}".getBytes(StandardCharsets.UTF_8))));
        assertThrows(InvalidEvaluationInputException.class,
                () -> loader.load(new ByteArrayInputStream("[{".getBytes(StandardCharsets.UTF_8))));
        assertThrows(InvalidEvaluationInputException.class, () -> loader.load(new ByteArrayInputStream(
                "[{\"db_id\":\"x\",\"table_names\":[\"t\"],\"column_names\":[[4,\"c\"]]}]"
                        .getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void load_shouldFail_whenFileMissing() {
        assertThrows(IllegalArgumentException.class,
                () -> new SchemaCatalogJsonLoader().load(tempDir.resolve("missing.json")));
    }
}
