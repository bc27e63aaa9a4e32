package domain.sql;

/**
 * Lightweight well-formedness check for a candidate query. Not a parser: it accepts anything
 * that starts with SELECT or WITH, has balanced parentheses and closed quotes, and has at
 * least one SELECT item before the first FROM.
 */
public final class SqlSyntaxValidator {

    private SqlSyntaxValidator() {
    }

    public static boolean isValid(String sql) {
        if (sql == null) return false;
        String t = sql.trim();
        while (t.endsWith(";")) t = t.substring(0, t.length() - 1).trim();
        if (t.isEmpty()) return false;

        SqlScan head = new SqlScan(t);
        if (!head.peekWord("SELECT") && !head.peekWord("WITH")) return false;

        return isBalanced(t) && hasSelectItem(t);
    }

    private static boolean isBalanced(String t) {
        int depth = 0;
        int i = 0;
        int n = t.length();
        while (i < n) {
            char c = t.charAt(i);
            if (c == '\'' || c == '"' || c == '`') {
                int close = closingQuote(t, i, c);
                if (close < 0) return false;
                i = close + 1;
                continue;
            }
            if (c == '(') depth++;
            else if (c == ')' && --depth < 0) return false;
            i++;
        }
        return depth == 0;
    }

    private static int closingQuote(String t, int open, char q) {
        int i = open + 1;
        while (i < t.length()) {
            if (t.charAt(i) == q) {
                if (i + 1 < t.length() && t.charAt(i + 1) == q) { i += 2; continue; }
                return i;
            }
            i++;
        }
        return -1;
    }

    private static boolean hasSelectItem(String t) {
        SqlScan st = new SqlScan(t);
        int depth = 0;
        boolean inSelect = false;
        boolean sawItem = false;

        while (st.hasNext()) {
            if (st.peekIsOpaque()) {
                st.readOpaque();
                if (inSelect) sawItem = true;
                continue;
            }
            char ch = st.peek();
            if (ch == '(') { depth++; st.read(); if (inSelect) sawItem = true; continue; }
            if (ch == ')') { depth = Math.max(0, depth - 1); st.read(); continue; }
            if (!SqlScan.isWordChar(ch)) {
                st.read();
                if (inSelect && ch == '*') sawItem = true;
                continue;
            }
            if (depth == 0 && st.peekWord("SELECT")) {
                inSelect = true;
                st.readWord();
                continue;
            }
            if (depth == 0 && inSelect && st.peekWord("FROM")) return sawItem;
            if (inSelect && !st.peekWord("DISTINCT") && !st.peekWord("ALL")) sawItem = true;
            st.readWord();
        }
        return inSelect && sawItem;
    }
}
