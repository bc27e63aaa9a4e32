package domain.schema;

import domain.model.InvalidEvaluationInputException;

import java.util.List;

/**
 * Immutable schema of one database, as found in the catalog document.
 *
 * <p>Construction validates the record: every column table index is -1 or a valid index into
 * {@code tableNames}, and key column indexes point into {@code columns}. A malformed record is an
 * input contract violation.</p>
 */
public final class SchemaRecord {

    private final String dbId;
    private final List<String> tableNames;
    private final List<SchemaColumn> columns;
    private final List<ForeignKey> foreignKeys;
    private final List<Integer> primaryKeys;

    public SchemaRecord(String dbId,
                        List<String> tableNames,
                        List<SchemaColumn> columns,
                        List<ForeignKey> foreignKeys,
                        List<Integer> primaryKeys) {
        if (dbId == null || dbId.isBlank()) {
            throw new InvalidEvaluationInputException("schema record without db_id");
        }
        this.dbId = dbId.trim();
        this.tableNames = tableNames == null ? List.of() : List.copyOf(tableNames);
        this.columns = columns == null ? List.of() : List.copyOf(columns);
        this.foreignKeys = foreignKeys == null ? List.of() : List.copyOf(foreignKeys);
        this.primaryKeys = primaryKeys == null ? List.of() : List.copyOf(primaryKeys);
        validate();
    }

    private void validate() {
        for (int i = 0; i < columns.size(); i++) {
            int t = columns.get(i).tableIndex;
            if (t != SchemaColumn.WILDCARD_TABLE && (t < 0 || t >= tableNames.size())) {
                throw new InvalidEvaluationInputException("schema '" + dbId + "': column " + i
                        + " has table index " + t + " but only " + tableNames.size() + " tables exist");
            }
        }
        for (ForeignKey fk : foreignKeys) {
            if (!isColumnIndex(fk.columnIndex) || !isColumnIndex(fk.referencedColumnIndex)) {
                throw new InvalidEvaluationInputException("schema '" + dbId + "': foreign key " + fk
                        + " references a column index out of range");
            }
        }
        for (Integer pk : primaryKeys) {
            if (pk == null || !isColumnIndex(pk)) {
                throw new InvalidEvaluationInputException("schema '" + dbId + "': primary key " + pk
                        + " references a column index out of range");
            }
        }
    }

    private boolean isColumnIndex(int i) {
        return i >= 0 && i < columns.size();
    }

    public String getDbId() {
        return dbId;
    }

    public List<String> getTableNames() {
        return tableNames;
    }

    public List<SchemaColumn> getColumns() {
        return columns;
    }

    public List<ForeignKey> getForeignKeys() {
        return foreignKeys;
    }

    public List<Integer> getPrimaryKeys() {
        return primaryKeys;
    }

    /** @return table name of the column, or null for the wildcard */
    public String tableOf(SchemaColumn c) {
        if (c == null || c.isWildcard()) return null;
        return tableNames.get(c.tableIndex);
    }
}
