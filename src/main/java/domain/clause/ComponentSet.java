package domain.clause;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Normalized atomic tokens per clause for one query.
 *
 * <p>Compared by exact string-set intersection. A clause the query omits has no entry;
 * {@link #get(SqlClause)} then returns an empty set.</p>
 */
public final class ComponentSet {

    private final Map<SqlClause, Set<String>> components;

    public ComponentSet(Map<SqlClause, Set<String>> components) {
        EnumMap<SqlClause, Set<String>> copy = new EnumMap<>(SqlClause.class);
        if (components != null) {
            for (Map.Entry<SqlClause, Set<String>> e : components.entrySet()) {
                copy.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
            }
        }
        this.components = Collections.unmodifiableMap(copy);
    }

    public Set<String> get(SqlClause clause) {
        Set<String> s = components.get(clause);
        return s == null ? Set.of() : s;
    }

    public boolean has(SqlClause clause) {
        return components.containsKey(clause);
    }

    public Map<SqlClause, Set<String>> asMap() {
        return components;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComponentSet)) return false;
        return components.equals(((ComponentSet) o).components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    @Override
    public String toString() {
        return "ComponentSet" + components;
    }
}
