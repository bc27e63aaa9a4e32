package domain.schema;

/** Column-index pair: {@code column -> referenced column}. */
public final class ForeignKey {

    public final int columnIndex;
    public final int referencedColumnIndex;

    public ForeignKey(int columnIndex, int referencedColumnIndex) {
        this.columnIndex = columnIndex;
        this.referencedColumnIndex = referencedColumnIndex;
    }

    @Override
    public String toString() {
        return columnIndex + "->" + referencedColumnIndex;
    }
}
