package infra.input;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import domain.model.InvalidEvaluationInputException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads predicted queries. Format follows the file extension:
 * <ul>
 *   <li>{@code .txt}: one query per line, optionally {@code <sql>\t<db_id>}; trailing blank
 *   lines are ignored, inner blank lines are empty predictions</li>
 *   <li>{@code .json}: array of strings, or of objects with {@code predicted_sql|sql|query}
 *   and optional {@code db_id}</li>
 *   <li>{@code .csv}: header row with a {@code predicted_sql} (or {@code sql}, {@code query})
 *   column and optional {@code db_id}</li>
 * </ul>
 */
public final class PredictionFileLoader {

    private final ObjectMapper mapper;

    public PredictionFileLoader() {
        this(new ObjectMapper());
    }

    public PredictionFileLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<Prediction> load(Path path) {
        if (path == null) throw new IllegalArgumentException("prediction path is null");
        if (!Files.exists(path)) throw new IllegalArgumentException("prediction file not found: " + path);

        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            if (name.endsWith(".json")) return loadJson(path);
            if (name.endsWith(".csv")) return loadCsv(path);
            return loadText(path);
        } catch (IOException e) {
            throw new IllegalStateException("failed to read predictions: " + path, e);
        }
    }

    private List<Prediction> loadText(Path path) throws IOException {
        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        int end = lines.size();
        while (end > 0 && lines.get(end - 1).isBlank()) end--;

        List<Prediction> out = new ArrayList<>(end);
        for (int i = 0; i < end; i++) {
            String line = i == 0 ? stripBom(lines.get(i)) : lines.get(i);
            int tab = line.lastIndexOf('\t');
            if (tab >= 0) out.add(new Prediction(line.substring(0, tab).trim(), line.substring(tab + 1)));
            else out.add(new Prediction(line.trim(), null));
        }
        return out;
    }

    private List<Prediction> loadJson(Path path) throws IOException {
        JsonNode root;
        try (InputStream is = Files.newInputStream(path)) {
            root = mapper.readTree(is);
        }
        if (root == null || !root.isArray()) {
            throw new InvalidEvaluationInputException("prediction JSON must be an array: " + path);
        }
        List<Prediction> out = new ArrayList<>(root.size());
        for (JsonNode n : root) {
            if (n.isTextual() || n.isNull()) {
                out.add(new Prediction(n.asText(""), null));
            } else {
                out.add(new Prediction(JsonFields.firstText(n, "predicted_sql", "sql", "query"),
                        JsonFields.firstText(n, "db_id")));
            }
        }
        return out;
    }

    private List<Prediction> loadCsv(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT
                     .builder()
                     .setTrim(true)
                     .build()
                     .parse(reader)) {

            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) return List.of();

            CSVRecord headerRec = it.next();
            Map<String, Integer> headerIndex = new LinkedHashMap<>();
            for (int i = 0; i < headerRec.size(); i++) {
                headerIndex.putIfAbsent(norm(stripBom(headerRec.get(i))), i);
            }
            Integer sqlIdx = firstIndex(headerIndex, "predicted_sql", "predictedsql", "sql", "query");
            if (sqlIdx == null) {
                throw new InvalidEvaluationInputException("prediction csv has no predicted_sql/sql column: " + path);
            }
            Integer dbIdx = firstIndex(headerIndex, "db_id", "dbid");

            List<Prediction> out = new ArrayList<>();
            while (it.hasNext()) {
                CSVRecord r = it.next();
                out.add(new Prediction(cell(r, sqlIdx), dbIdx == null ? null : cell(r, dbIdx)));
            }
            return out;
        }
    }

    private static Integer firstIndex(Map<String, Integer> headerIndex, String... keys) {
        for (String k : keys) {
            Integer i = headerIndex.get(norm(k));
            if (i != null) return i;
        }
        return null;
    }

    private static String cell(CSVRecord r, int idx) {
        return idx < r.size() ? r.get(idx) : "";
    }

    private static String norm(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT).replace(" ", "");
    }

    private static String stripBom(String s) {
        if (s == null || s.isEmpty()) return s;
        return s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
    }
}
