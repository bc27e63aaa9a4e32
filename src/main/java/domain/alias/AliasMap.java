package domain.alias;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * alias -> table mapping for a single query, derived from its FROM/JOIN clauses.
 *
 * <p>Immutable; produced once per query by {@link FromJoinAliasResolver} and passed explicitly
 * to rewriting and binding. Keys and values are in {@code normalizeQuery} form.</p>
 */
public final class AliasMap {

    private static final AliasMap EMPTY = new AliasMap(Map.of(), Set.of(), Set.of());

    private final Map<String, String> aliasToTable;
    private final Set<String> tables;
    private final Set<String> derivedAliases;

    AliasMap(Map<String, String> aliasToTable, Set<String> tables, Set<String> derivedAliases) {
        this.aliasToTable = Collections.unmodifiableMap(new LinkedHashMap<>(aliasToTable));
        this.tables = Collections.unmodifiableSet(new LinkedHashSet<>(tables));
        this.derivedAliases = Collections.unmodifiableSet(new LinkedHashSet<>(derivedAliases));
    }

    public static AliasMap empty() {
        return EMPTY;
    }

    /** Test/adapter factory: plain alias map without table or derived-alias bookkeeping. */
    public static AliasMap of(Map<String, String> aliasToTable) {
        if (aliasToTable == null || aliasToTable.isEmpty()) return EMPTY;
        return new AliasMap(aliasToTable, new LinkedHashSet<>(aliasToTable.values()), Set.of());
    }

    /** @return table for the alias, or null */
    public String tableFor(String alias) {
        if (alias == null) return null;
        return aliasToTable.get(alias);
    }

    public boolean isAlias(String token) {
        return token != null && aliasToTable.containsKey(token);
    }

    /** Alias of a derived table ({@code FROM (SELECT ...) x}); known, but not mappable to a table. */
    public boolean isDerivedAlias(String token) {
        return token != null && derivedAliases.contains(token);
    }

    /** Every table named after FROM/JOIN, in order of appearance. */
    public Set<String> tables() {
        return tables;
    }

    public Map<String, String> asMap() {
        return aliasToTable;
    }

    public boolean isEmpty() {
        return aliasToTable.isEmpty();
    }

    @Override
    public String toString() {
        return "AliasMap" + aliasToTable;
    }
}
