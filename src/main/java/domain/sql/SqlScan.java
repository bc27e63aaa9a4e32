package domain.sql;

/**
 * Character cursor over SQL text with look-ahead helpers for words, quoted literals,
 * comments and parenthesized blocks.
 *
 * <p>All keyword checks are case-insensitive and require word boundaries on both sides.
 * Identifier characters include Unicode letters, digits, combining marks and {@code _ $},
 * so Vietnamese identifiers scan as single words.</p>
 */
public final class SqlScan {
    final String s;
    int pos = 0;

    public SqlScan(String s) {
        this.s = (s == null) ? "" : s;
    }

    public static boolean isWordChar(char c) {
        if (Character.isLetterOrDigit(c) || c == '_' || c == '$') return true;
        int t = Character.getType(c);
        return t == Character.NON_SPACING_MARK || t == Character.COMBINING_SPACING_MARK;
    }

    public int pos() {
        return pos;
    }

    public void seek(int p) {
        pos = Math.max(0, Math.min(p, s.length()));
    }

    public String text() {
        return s;
    }

    public boolean hasNext() {
        return pos < s.length();
    }

    public char peek() {
        return (pos < s.length()) ? s.charAt(pos) : '\0';
    }

    public char read() {
        return (pos < s.length()) ? s.charAt(pos++) : '\0';
    }

    public boolean peekWord(String kw) {
        return matchesWordAt(pos, kw);
    }

    private boolean matchesWordAt(int at, String kw) {
        int n = kw.length();
        if (at + n > s.length()) return false;
        if (at > 0 && isWordChar(s.charAt(at - 1))) return false;

        for (int i = 0; i < n; i++) {
            if (Character.toUpperCase(s.charAt(at + i)) != Character.toUpperCase(kw.charAt(i))) return false;
        }
        return at + n >= s.length() || !isWordChar(s.charAt(at + n));
    }

    /**
     * Multi-word keyword such as {@code GROUP BY} or {@code NOT IN}, with any run of
     * whitespace (newlines included) between the words.
     *
     * @return length of the matched text, or -1
     */
    public int peekKeyword(String... words) {
        int p = pos;
        for (int w = 0; w < words.length; w++) {
            if (w > 0) {
                int q = p;
                while (q < s.length() && Character.isWhitespace(s.charAt(q))) q++;
                if (q == p) return -1;
                p = q;
            }
            if (!matchesWordAt(p, words[w])) return -1;
            p += words[w].length();
        }
        return p - pos;
    }

    public String readWord() {
        int start = pos;
        while (pos < s.length() && isWordChar(s.charAt(pos))) pos++;
        return s.substring(start, pos);
    }

    public String readSpaces() {
        int start = pos;
        while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) pos++;
        return s.substring(start, pos);
    }

    public boolean peekIsLineComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '-' && s.charAt(pos + 1) == '-';
    }

    public boolean peekIsBlockComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '/' && s.charAt(pos + 1) == '*';
    }

    public boolean peekIsSingleQuotedString() {
        return pos < s.length() && s.charAt(pos) == '\'';
    }

    public boolean peekIsDoubleQuotedString() {
        return pos < s.length() && s.charAt(pos) == '"';
    }

    public boolean peekIsBacktickQuoted() {
        return pos < s.length() && s.charAt(pos) == '`';
    }

    /** Any atomic block that must never be split or interpreted: literal, quoted name, comment. */
    public boolean peekIsOpaque() {
        return peekIsLineComment() || peekIsBlockComment() || peekIsSingleQuotedString()
                || peekIsDoubleQuotedString() || peekIsBacktickQuoted();
    }

    public String readOpaque() {
        if (peekIsLineComment()) return readLineComment();
        if (peekIsBlockComment()) return readBlockComment();
        if (peekIsSingleQuotedString()) return readSingleQuotedString();
        if (peekIsDoubleQuotedString()) return readQuoted('"');
        if (peekIsBacktickQuoted()) return readQuoted('`');
        return "";
    }

    public String readLineComment() {
        int start = pos;
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == '\n') break;
        }
        return s.substring(start, pos);
    }

    public String readBlockComment() {
        int start = pos;
        pos += 2; // /*
        while (pos + 1 < s.length()) {
            if (s.charAt(pos) == '*' && s.charAt(pos + 1) == '/') {
                pos += 2;
                return s.substring(start, pos);
            }
            pos++;
        }
        pos = s.length();
        return s.substring(start, pos);
    }

    public String readSingleQuotedString() {
        int start = pos;
        pos++; // '
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == '\'') {
                // escaped ''
                if (pos < s.length() && s.charAt(pos) == '\'') {
                    pos++;
                    continue;
                }
                break;
            }
        }
        return s.substring(start, pos);
    }

    private String readQuoted(char q) {
        int start = pos;
        pos++;
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == q) break;
        }
        return s.substring(start, pos);
    }

    public String readParenBlock() {
        if (peek() != '(') return "";
        int start = pos;
        int depth = 0;

        while (pos < s.length()) {
            if (peekIsOpaque()) { readOpaque(); continue; }

            char c = read();
            if (c == '(') depth++;
            else if (c == ')') {
                depth--;
                if (depth == 0) break;
            }
        }

        return s.substring(start, pos);
    }
}
