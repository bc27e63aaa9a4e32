package domain.exec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One result tuple with values normalized for comparison: integral numbers become
 * {@link Long} (so {@code 5} and {@code 5.0} are equal), other numbers {@link Double},
 * blobs a lower-case hex string.
 */
public final class ResultRow {

    private final List<Object> values;

    public ResultRow(List<?> values) {
        List<Object> copy = new ArrayList<>(values == null ? 0 : values.size());
        if (values != null) {
            for (Object v : values) copy.add(normalizeValue(v));
        }
        this.values = Collections.unmodifiableList(copy);
    }

    public static ResultRow of(Object... values) {
        List<Object> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        return new ResultRow(list);
    }

    static Object normalizeValue(Object v) {
        if (v == null || v instanceof String || v instanceof Boolean) return v;
        if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
            return ((Number) v).longValue();
        }
        if (v instanceof BigInteger) {
            BigInteger b = (BigInteger) v;
            return b.bitLength() < 64 ? (Object) b.longValue() : b.toString();
        }
        if (v instanceof BigDecimal) {
            return normalizeDouble(((BigDecimal) v).doubleValue());
        }
        if (v instanceof Number) {
            return normalizeDouble(((Number) v).doubleValue());
        }
        if (v instanceof byte[]) {
            return toHex((byte[]) v);
        }
        return v.toString();
    }

    private static Object normalizeDouble(double d) {
        if (!Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d) && Math.abs(d) < 9.0e15) {
            return (long) d;
        }
        return d;
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }

    public List<Object> getValues() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResultRow)) return false;
        return values.equals(((ResultRow) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
