package domain.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Splits SQL fragments at top-level depth, ignoring literals, quoted names and comments. */
public final class SqlTopLevelSplitter {
    private static final Set<String> JOIN_MODIFIERS = Set.of(
            "left", "right", "inner", "outer", "full", "cross", "natural");

    private SqlTopLevelSplitter() {}

    public static List<String> splitTopLevelByComma(String s) {
        List<String> out = new ArrayList<>();
        if (s == null || s.isEmpty()) return out;

        StringBuilder cur = new StringBuilder();
        SqlScan st = new SqlScan(s);
        int depth = 0;

        while (st.hasNext()) {
            if (st.peekIsOpaque()) { cur.append(st.readOpaque()); continue; }

            char ch = st.read();
            if (ch == '(') depth++;
            else if (ch == ')') depth = Math.max(0, depth - 1);

            if (ch == ',' && depth == 0) {
                out.add(cur.toString());
                cur.setLength(0);
            } else {
                cur.append(ch);
            }
        }

        if (cur.length() > 0) out.add(cur.toString());
        return out;
    }

    /**
     * Splits on top-level {@code AND} / {@code OR}. The {@code AND} that closes a
     * {@code BETWEEN x AND y} range stays inside its fragment.
     */
    public static List<String> splitTopLevelByLogical(String s) {
        List<String> out = new ArrayList<>();
        if (s == null || s.isEmpty()) return out;

        StringBuilder cur = new StringBuilder();
        SqlScan st = new SqlScan(s);
        int depth = 0;
        int pendingBetween = 0;

        while (st.hasNext()) {
            if (st.peekIsOpaque()) { cur.append(st.readOpaque()); continue; }

            if (depth == 0 && SqlScan.isWordChar(st.peek())) {
                if (st.peekWord("BETWEEN")) {
                    pendingBetween++;
                    cur.append(st.readWord());
                    continue;
                }
                if (st.peekWord("AND")) {
                    if (pendingBetween > 0) {
                        pendingBetween--;
                        cur.append(st.readWord());
                        continue;
                    }
                    st.readWord();
                    out.add(cur.toString());
                    cur.setLength(0);
                    continue;
                }
                if (st.peekWord("OR")) {
                    st.readWord();
                    out.add(cur.toString());
                    cur.setLength(0);
                    continue;
                }
                cur.append(st.readWord());
                continue;
            }

            char ch = st.read();
            if (ch == '(') depth++;
            else if (ch == ')') depth = Math.max(0, depth - 1);
            cur.append(ch);
        }

        out.add(cur.toString());
        return out;
    }

    /**
     * Splits a FROM body on top-level {@code JOIN}. Join modifiers in front of the keyword
     * ({@code LEFT}, {@code INNER OUTER}, {@code NATURAL}...) are dropped with it.
     */
    public static List<String> splitTopLevelByJoin(String s) {
        List<String> out = new ArrayList<>();
        if (s == null || s.isEmpty()) return out;

        StringBuilder cur = new StringBuilder();
        SqlScan st = new SqlScan(s);
        int depth = 0;

        while (st.hasNext()) {
            if (st.peekIsOpaque()) { cur.append(st.readOpaque()); continue; }

            if (SqlScan.isWordChar(st.peek())) {
                if (depth == 0 && st.peekWord("JOIN")) {
                    st.readWord();
                    out.add(dropTrailingJoinModifiers(cur.toString()));
                    cur.setLength(0);
                    continue;
                }
                cur.append(st.readWord());
                continue;
            }

            char ch = st.read();
            if (ch == '(') depth++;
            else if (ch == ')') depth = Math.max(0, depth - 1);
            cur.append(ch);
        }

        out.add(cur.toString());
        return out;
    }

    private static String dropTrailingJoinModifiers(String frag) {
        String t = frag.stripTrailing();
        while (true) {
            int sp = t.lastIndexOf(' ');
            String last = (sp < 0 ? t : t.substring(sp + 1)).toLowerCase(Locale.ROOT);
            if (!JOIN_MODIFIERS.contains(last)) return t;
            t = (sp < 0 ? "" : t.substring(0, sp)).stripTrailing();
        }
    }

    /**
     * Position of the first top-level occurrence of any of the given keywords, or -1.
     */
    public static int indexOfTopLevelWord(String s, String... words) {
        if (s == null || s.isEmpty()) return -1;
        SqlScan st = new SqlScan(s);
        int depth = 0;

        while (st.hasNext()) {
            if (st.peekIsOpaque()) { st.readOpaque(); continue; }

            if (SqlScan.isWordChar(st.peek())) {
                if (depth == 0) {
                    for (String w : words) {
                        if (st.peekWord(w)) return st.pos();
                    }
                }
                st.readWord();
                continue;
            }

            char ch = st.read();
            if (ch == '(') depth++;
            else if (ch == ')') depth = Math.max(0, depth - 1);
        }
        return -1;
    }

    /**
     * Position of the last top-level occurrence of the given keyword, or -1.
     */
    public static int lastIndexOfTopLevelWord(String s, String word) {
        if (s == null || s.isEmpty()) return -1;
        SqlScan st = new SqlScan(s);
        int depth = 0;
        int found = -1;

        while (st.hasNext()) {
            if (st.peekIsOpaque()) { st.readOpaque(); continue; }

            if (SqlScan.isWordChar(st.peek())) {
                if (depth == 0 && st.peekWord(word)) found = st.pos();
                st.readWord();
                continue;
            }

            char ch = st.read();
            if (ch == '(') depth++;
            else if (ch == ')') depth = Math.max(0, depth - 1);
        }
        return found;
    }

    /**
     * True if a {@code SELECT} keyword appears inside any parenthesized block.
     */
    public static boolean hasNestedSelect(String s) {
        if (s == null || s.isEmpty()) return false;
        SqlScan st = new SqlScan(s);
        int depth = 0;

        while (st.hasNext()) {
            if (st.peekIsOpaque()) { st.readOpaque(); continue; }

            if (SqlScan.isWordChar(st.peek())) {
                if (depth > 0 && st.peekWord("SELECT")) return true;
                st.readWord();
                continue;
            }

            char ch = st.read();
            if (ch == '(') depth++;
            else if (ch == ')') depth = Math.max(0, depth - 1);
        }
        return false;
    }

    /**
     * Replaces every single-quoted literal with {@code ''} so keyword detection cannot
     * match text inside values. Comments are dropped.
     */
    public static String maskLiterals(String s) {
        if (s == null || s.isEmpty()) return "";
        StringBuilder out = new StringBuilder(s.length());
        SqlScan st = new SqlScan(s);

        while (st.hasNext()) {
            if (st.peekIsSingleQuotedString()) {
                st.readSingleQuotedString();
                out.append("''");
                continue;
            }
            if (st.peekIsLineComment() || st.peekIsBlockComment()) {
                st.readOpaque();
                out.append(' ');
                continue;
            }
            if (st.peekIsOpaque()) { out.append(st.readOpaque()); continue; }
            out.append(st.read());
        }
        return out.toString();
    }
}
