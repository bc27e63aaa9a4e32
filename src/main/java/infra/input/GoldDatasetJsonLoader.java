package infra.input;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import domain.model.InvalidEvaluationInputException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the gold dataset: a JSON array of {@code {question, query|sql, db_id, question_id?}}.
 */
public final class GoldDatasetJsonLoader {

    private final ObjectMapper mapper;

    public GoldDatasetJsonLoader() {
        this(new ObjectMapper());
    }

    public GoldDatasetJsonLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<GoldExample> load(Path path) {
        if (path == null) throw new IllegalArgumentException("dataset path is null");
        if (!Files.exists(path)) throw new IllegalArgumentException("dataset not found: " + path);

        JsonNode root;
        try (InputStream is = Files.newInputStream(path)) {
            root = mapper.readTree(is);
        } catch (IOException e) {
            throw new IllegalStateException("failed to read dataset: " + path, e);
        }
        if (root == null || !root.isArray()) {
            throw new InvalidEvaluationInputException("dataset must be a JSON array: " + path);
        }

        List<GoldExample> out = new ArrayList<>(root.size());
        int i = 0;
        for (JsonNode n : root) {
            String sql = JsonFields.firstText(n, "query", "sql", "gold_sql", "SQL");
            String dbId = JsonFields.firstText(n, "db_id");
            if (dbId.isBlank()) {
                throw new InvalidEvaluationInputException("dataset entry " + i + " has no db_id: " + path);
            }
            String qid = JsonFields.firstText(n, "question_id", "id");
            out.add(new GoldExample(qid.isEmpty() ? String.valueOf(i) : qid,
                    JsonFields.firstText(n, "question"), sql, dbId));
            i++;
        }
        return out;
    }
}
