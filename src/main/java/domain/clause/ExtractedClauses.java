package domain.clause;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Raw clause texts of one query.
 *
 * <p>An omitted clause has no entry; a clause that is present but has no body maps to
 * {@code ""}. The two are different: both sides omitting WHERE is a vacuous match.</p>
 */
public final class ExtractedClauses {

    private final Map<SqlClause, String> texts;
    private final boolean degraded;

    ExtractedClauses(Map<SqlClause, String> texts, boolean degraded) {
        EnumMap<SqlClause, String> copy = new EnumMap<>(SqlClause.class);
        copy.putAll(texts);
        this.texts = Collections.unmodifiableMap(copy);
        this.degraded = degraded;
    }

    public Optional<String> get(SqlClause clause) {
        return Optional.ofNullable(texts.get(clause));
    }

    public boolean isPresent(SqlClause clause) {
        return texts.containsKey(clause);
    }

    public Map<SqlClause, String> asMap() {
        return texts;
    }

    /** True when the input was not blank but no SELECT clause could be located. */
    public boolean isDegraded() {
        return degraded;
    }

    @Override
    public String toString() {
        return "ExtractedClauses" + texts + (degraded ? " (degraded)" : "");
    }
}
