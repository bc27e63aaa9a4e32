package domain.schema;

/**
 * One {@code [table_index, column_name]} entry of a schema record.
 * Table index -1 is the wildcard column {@code *}.
 */
public final class SchemaColumn {

    public static final int WILDCARD_TABLE = -1;

    public final int tableIndex;
    public final String name;
    public final String type;

    public SchemaColumn(int tableIndex, String name, String type) {
        this.tableIndex = tableIndex;
        this.name = name == null ? "" : name;
        this.type = type == null ? "" : type;
    }

    public boolean isWildcard() {
        return tableIndex == WILDCARD_TABLE;
    }

    @Override
    public String toString() {
        return "SchemaColumn{" + tableIndex + ", '" + name + "'}";
    }
}
