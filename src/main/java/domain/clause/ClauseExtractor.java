package domain.clause;

import domain.sql.SqlScan;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a query into SELECT / FROM / WHERE / GROUP BY / ORDER BY / HAVING texts.
 *
 * <p>Boundaries are the first top-level (outside parentheses, literals and comments)
 * occurrence of each clause keyword after the first top-level SELECT. Each clause runs to
 * the next boundary, so clauses never overlap. Scanning for new boundaries stops at a
 * top-level UNION / INTERSECT / EXCEPT; the rest of the text, like LIMIT or any other
 * construct outside the six clauses, is folded into the preceding clause.</p>
 *
 * <p>Case-insensitive; multi-word keywords tolerate any whitespace including newlines.</p>
 */
public final class ClauseExtractor {

    private ClauseExtractor() {
    }

    private static final class Boundary {
        final SqlClause clause;
        final int start;
        final int bodyStart;

        Boundary(SqlClause clause, int start, int bodyStart) {
            this.clause = clause;
            this.start = start;
            this.bodyStart = bodyStart;
        }
    }

    public static ExtractedClauses extract(String sql) {
        Map<SqlClause, String> out = new EnumMap<>(SqlClause.class);
        if (sql == null || sql.isBlank()) return new ExtractedClauses(out, false);

        List<Boundary> boundaries = findBoundaries(sql);
        if (boundaries.isEmpty()) return new ExtractedClauses(out, true);

        for (int i = 0; i < boundaries.size(); i++) {
            Boundary b = boundaries.get(i);
            int end = (i + 1 < boundaries.size()) ? boundaries.get(i + 1).start : sql.length();
            out.put(b.clause, sql.substring(Math.min(b.bodyStart, end), end).trim());
        }
        return new ExtractedClauses(out, false);
    }

    private static List<Boundary> findBoundaries(String sql) {
        List<Boundary> found = new ArrayList<>();
        SqlScan st = new SqlScan(sql);
        int depth = 0;
        boolean seenSelect = false;

        while (st.hasNext()) {
            if (st.peekIsOpaque()) { st.readOpaque(); continue; }

            char ch = st.peek();
            if (ch == '(') { depth++; st.read(); continue; }
            if (ch == ')') { depth = Math.max(0, depth - 1); st.read(); continue; }
            if (!SqlScan.isWordChar(ch)) { st.read(); continue; }

            if (depth > 0) { st.readWord(); continue; }

            int at = st.pos();
            if (!seenSelect) {
                if (st.peekWord("SELECT")) {
                    seenSelect = true;
                    found.add(new Boundary(SqlClause.SELECT, at, at + "SELECT".length()));
                }
                st.readWord();
                continue;
            }

            if (st.peekWord("UNION") || st.peekWord("INTERSECT") || st.peekWord("EXCEPT")) break;

            SqlClause clause = null;
            int len = -1;
            if (st.peekWord("FROM")) { clause = SqlClause.FROM; len = 4; }
            else if (st.peekWord("WHERE")) { clause = SqlClause.WHERE; len = 5; }
            else if (st.peekWord("HAVING")) { clause = SqlClause.HAVING; len = 6; }
            else if ((len = st.peekKeyword("GROUP", "BY")) > 0) clause = SqlClause.GROUP_BY;
            else if ((len = st.peekKeyword("ORDER", "BY")) > 0) clause = SqlClause.ORDER_BY;

            if (clause != null && !contains(found, clause)) {
                found.add(new Boundary(clause, at, at + len));
                st.seek(at + len);
                continue;
            }
            st.readWord();
        }
        return found;
    }

    private static boolean contains(List<Boundary> found, SqlClause clause) {
        for (Boundary b : found) {
            if (b.clause == clause) return true;
        }
        return false;
    }
}
