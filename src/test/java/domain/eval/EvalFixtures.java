package domain.eval;

import domain.schema.SchemaCatalog;
import domain.schema.SchemaColumn;
import domain.schema.SchemaRecord;

import java.util.List;

final class EvalFixtures {

    private EvalFixtures() {
    }

    static SchemaCatalog schoolCatalog() {
        SchemaRecord school = new SchemaRecord(
                "school",
                List.of("hoc_sinh", "lop"),
                List.of(
                        new SchemaColumn(-1, "*", "text"),
                        new SchemaColumn(0, "ten_hoc_sinh", "text"),
                        new SchemaColumn(0, "tuoi", "number"),
                        new SchemaColumn(0, "lop_id", "number"),
                        new SchemaColumn(1, "lop_id", "number"),
                        new SchemaColumn(1, "ten_lop", "text")
                ),
                List.of(),
                List.of(4)
        );
        return new SchemaCatalog(List.of(school));
    }
}
