package domain.schema;

import domain.model.InvalidEvaluationInputException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaCatalogTest {

    @Test
    void constructor_shouldRejectDuplicateDbId() {
        SchemaRecord a = SchemaBinderTest.school();
        SchemaRecord b = SchemaBinderTest.school();

        assertThrows(InvalidEvaluationInputException.class, () -> new SchemaCatalog(List.of(a, b)));
    }

    @Test
    void binderFor_shouldCacheBinderPerDbId() {
        SchemaCatalog catalog = new SchemaCatalog(List.of(SchemaBinderTest.school()));

        SchemaBinder first = catalog.binderFor("school");
        assertNotNull(first);
        assertSame(first, catalog.binderFor(" school "));
        assertNull(catalog.binderFor("unknown"));
        assertFalse(catalog.contains("unknown"));
        assertEquals(1, catalog.size());
    }

    @Test
    void schemaRecord_shouldRejectOutOfRangeTableIndex() {
        assertThrows(InvalidEvaluationInputException.class, () -> new SchemaRecord(
                "bad",
                List.of("t"),
                List.of(new SchemaColumn(3, "c", "text")),
                List.of(),
                List.of()
        ));
    }

    @Test
    void schemaRecord_shouldRejectOutOfRangeKeyIndexes() {
        List<SchemaColumn> cols = List.of(new SchemaColumn(0, "c", "text"));

        assertThrows(InvalidEvaluationInputException.class,
                () -> new SchemaRecord("bad", List.of("t"), cols, List.of(new ForeignKey(0, 9)), List.of()));
        assertThrows(InvalidEvaluationInputException.class,
                () -> new SchemaRecord("bad", List.of("t"), cols, List.of(), List.of(5)));
        assertThrows(InvalidEvaluationInputException.class,
                () -> new SchemaRecord(" ", List.of("t"), cols, List.of(), List.of()));
    }

    @Test
    void schemaRecord_tableOf_shouldReturnNullForWildcard() {
        SchemaRecord r = SchemaBinderTest.school();

        assertNull(r.tableOf(r.getColumns().get(0)));
        assertEquals("lop", r.tableOf(r.getColumns().get(5)));
    }
}
