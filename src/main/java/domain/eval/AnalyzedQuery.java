package domain.eval;

import domain.alias.AliasMap;
import domain.clause.ComponentSet;
import domain.clause.ExtractedClauses;

/**
 * Output of the per-query pipeline: normalize, resolve aliases, extract clauses, bind.
 */
public final class AnalyzedQuery {

    private final String raw;
    private final String normalized;
    private final String resolved;
    private final AliasMap aliases;
    private final ExtractedClauses clauses;
    private final ComponentSet components;
    private final boolean syntaxValid;

    public AnalyzedQuery(String raw, String normalized, String resolved, AliasMap aliases,
                         ExtractedClauses clauses, ComponentSet components, boolean syntaxValid) {
        this.raw = raw;
        this.normalized = normalized;
        this.resolved = resolved;
        this.aliases = aliases;
        this.clauses = clauses;
        this.components = components;
        this.syntaxValid = syntaxValid;
    }

    public String getRaw() {
        return raw;
    }

    /** Exact-match form: fully normalized, aliases untouched. */
    public String getNormalized() {
        return normalized;
    }

    /** Structural form with aliases rewritten to table names. */
    public String getResolved() {
        return resolved;
    }

    public AliasMap getAliases() {
        return aliases;
    }

    public ExtractedClauses getClauses() {
        return clauses;
    }

    public ComponentSet getComponents() {
        return components;
    }

    public boolean isSyntaxValid() {
        return syntaxValid;
    }

    public boolean isDegraded() {
        return clauses.isDegraded();
    }
}
