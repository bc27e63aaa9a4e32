package domain.normalize;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalizes SQL text so that lexical variants collapse to one representation.
 *
 * <p>Two entry points:
 * <ul>
 *   <li>{@link #normalizeQuery(String)}: NFC, lower-case, whitespace collapse, trim, trailing
 *   {@code ;} removal and aggregate call spacing. Identifiers keep their underscores so the
 *   clause and alias scanners still see them as single words.</li>
 *   <li>{@link #normalize(String)}: everything above plus underscore/space folding. Used for
 *   component tokens and exact-match strings.</li>
 * </ul>
 * Both are pure, null-safe and idempotent.</p>
 */
public final class SqlTextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** {@code count_distinct} appears as {@code count distinct} once underscores are folded. */
    private static final Pattern AGGREGATE_OPEN = Pattern.compile(
            "\\b(count_distinct|count distinct|count|min|max|sum|avg)\\s*\\(\\s*",
            Pattern.UNICODE_CHARACTER_CLASS);

    private SqlTextNormalizer() {
    }

    public static String normalize(String text) {
        return canonicalize(text, true);
    }

    public static String normalizeQuery(String text) {
        return canonicalize(text, false);
    }

    /** Normalized identifier key: the form used to compare table/column names. */
    public static String identifierKey(String ident) {
        return normalize(ident);
    }

    private static String canonicalize(String text, boolean foldUnderscore) {
        if (text == null || text.isEmpty()) return "";

        String t = Normalizer.normalize(text, Normalizer.Form.NFC);
        t = t.toLowerCase(Locale.ROOT);
        if (foldUnderscore) t = t.replace('_', ' ');
        t = WHITESPACE.matcher(t).replaceAll(" ").trim();
        t = normalizeFunctionSpacing(t);
        return stripTrailingSemicolons(t);
    }

    /**
     * {@code FUNC ( arg )}, {@code FUNC( arg )}, {@code FUNC (arg)} become {@code FUNC(arg)} for
     * the aggregate functions. Input is expected to be lower-cased already.
     */
    static String normalizeFunctionSpacing(String t) {
        if (t.indexOf('(') < 0) return t;

        Matcher m = AGGREGATE_OPEN.matcher(t).useTransparentBounds(true);
        StringBuilder out = new StringBuilder(t.length());
        int last = 0;
        while (m.find()) {
            if (m.start() < last) continue;
            out.append(t, last, m.start()).append(m.group(1)).append('(');

            int open = t.indexOf('(', m.start() + m.group(1).length());
            int close = matchingClose(t, open);
            if (close < 0) {
                last = m.end();
                continue;
            }
            int innerEnd = close;
            while (innerEnd > m.end() && t.charAt(innerEnd - 1) == ' ') innerEnd--;
            out.append(normalizeFunctionSpacing(t.substring(m.end(), innerEnd))).append(')');
            last = close + 1;
            m.region(last, t.length());
        }
        out.append(t, last, t.length());
        return out.toString();
    }

    private static int matchingClose(String t, int open) {
        int depth = 0;
        boolean inQuote = false;
        for (int i = open; i < t.length(); i++) {
            char c = t.charAt(i);
            if (c == '\'') inQuote = !inQuote;
            if (inQuote) continue;
            if (c == '(') depth++;
            else if (c == ')') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    private static String stripTrailingSemicolons(String t) {
        int end = t.length();
        while (end > 0 && (t.charAt(end - 1) == ';' || t.charAt(end - 1) == ' ')) end--;
        return (end == t.length()) ? t : t.substring(0, end);
    }
}
