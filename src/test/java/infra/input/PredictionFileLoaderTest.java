package infra.input;

import domain.model.InvalidEvaluationInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PredictionFileLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldReadOneQueryPerLine_andIgnoreTrailingBlankLines() throws Exception {
        Path file = tempDir.resolve("pred.txt");
        Files.writeString(file, "\uFEFFSELECT a FROM t\n\nSELECT b FROM u\tshop\n\n\n");

        List<Prediction> preds = new PredictionFileLoader().load(file);

        assertEquals(3, preds.size());
        assertEquals("SELECT a FROM t", preds.get(0).getSql());
        assertEquals("", preds.get(0).getDbId());
        assertEquals("", preds.get(1).getSql(), "inner blank line is an empty prediction");
        assertEquals("SELECT b FROM u", preds.get(2).getSql());
        assertEquals("shop", preds.get(2).getDbId());
    }

    @Test
    void load_shouldReadJsonStringsAndObjects() throws Exception {
        Path file = tempDir.resolve("pred.json");
        Files.writeString(file, "[\"SELECT 1\", {\"predicted_sql\": \"SELECT 2\", \"db_id\": \"x\"}, "
                + "{\"sql\": \"SELECT 3\"}]");

        List<Prediction> preds = new PredictionFileLoader().load(file);

        assertEquals(3, preds.size());
        assertEquals("SELECT 1", preds.get(0).getSql());
        assertEquals("SELECT 2", preds.get(1).getSql());
        assertEquals("x", preds.get(1).getDbId());
        assertEquals("SELECT 3", preds.get(2).getSql());
    }

    @Test
    void load_shouldReadCsvByHeaderName() throws Exception {
        Path file = tempDir.resolve("pred.csv");
        Files.writeString(file, "question,Predicted_SQL,db_id\n"
                + "q1,\"SELECT a, b FROM t\",shop\n"
                + "q2,SELECT c FROM u,shop\n");

        List<Prediction> preds = new PredictionFileLoader().load(file);

        assertEquals(2, preds.size());
        assertEquals("SELECT a, b FROM t", preds.get(0).getSql());
        assertEquals("shop", preds.get(1).getDbId());
    }

    @Test
    void load_shouldRejectCsvWithoutQueryColumn() throws Exception {
        Path file = tempDir.resolve("pred.csv");
        Files.writeString(file, "question,answer\nq1,a1\n");

        assertThrows(InvalidEvaluationInputException.class, () -> new PredictionFileLoader().load(file));
    }

    @Test
    void load_shouldRejectJsonThatIsNotAnArray() throws Exception {
        Path file = tempDir.resolve("pred.json");
        Files.writeString(file, "{\"sql\": \"SELECT 1\"}");

        assertThrows(InvalidEvaluationInputException.class, () -> new PredictionFileLoader().load(file));
    }
}
