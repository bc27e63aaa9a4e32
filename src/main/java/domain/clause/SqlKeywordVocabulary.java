package domain.clause;

import domain.sql.SqlTopLevelSplitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Fixed keyword vocabulary for the KEYWORDS component.
 *
 * <p>Matched on word boundaries (Unicode aware) against the query with string literals
 * masked, so {@code IN} never matches inside {@code JOIN} or {@code 'Inland'}.</p>
 */
public final class SqlKeywordVocabulary {

    private static final List<String> WORDS = List.of(
            "select", "from", "where", "group by", "order by", "having",
            "join", "left join", "right join", "inner join", "outer join", "full join", "cross join",
            "union", "intersect", "except", "with", "distinct",
            "count", "sum", "avg", "max", "min",
            "case", "when", "then", "else", "end",
            "and", "or", "not", "in", "exists", "like", "between", "is null", "null",
            "asc", "desc", "limit", "offset"
    );

    private static final Map<String, Pattern> PATTERNS = new LinkedHashMap<>();

    static {
        for (String w : WORDS) {
            String body = String.join("\\s+", w.split(" "));
            // LEFT OUTER JOIN still counts as LEFT JOIN
            if (w.endsWith(" join") && !w.startsWith("outer") && !w.startsWith("cross")) {
                body = body.replace("\\s+join", "\\s+(?:outer\\s+)?join");
            }
            PATTERNS.put(w, Pattern.compile("(?<![\\p{L}\\p{N}_])" + body + "(?![\\p{L}\\p{N}_])",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
    }

    private SqlKeywordVocabulary() {
    }

    public static List<String> words() {
        return WORDS;
    }

    public static Set<String> keywordsIn(String sql) {
        if (sql == null || sql.isBlank()) return Collections.emptySet();
        String masked = SqlTopLevelSplitter.maskLiterals(sql).toLowerCase(Locale.ROOT);

        Set<String> out = new LinkedHashSet<>();
        for (Map.Entry<String, Pattern> e : PATTERNS.entrySet()) {
            if (e.getValue().matcher(masked).find()) out.add(e.getKey());
        }
        return out;
    }

    /** Clause keywords in {@code required} that are missing from {@code actual}. */
    public static List<String> missing(Set<String> required, Set<String> actual) {
        List<String> out = new ArrayList<>();
        for (String k : required) {
            if (!actual.contains(k)) out.add(k);
        }
        return out;
    }
}
