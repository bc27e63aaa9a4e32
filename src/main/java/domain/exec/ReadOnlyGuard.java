package domain.exec;

import domain.sql.SqlTopLevelSplitter;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects write and DDL statements. String literals are masked first, so
 * {@code WHERE note = 'drop table'} is still read-only. {@code REPLACE} is only a write when
 * used as {@code REPLACE INTO} or as the statement keyword; the string function is allowed.
 */
public final class ReadOnlyGuard {

    private static final Pattern WRITE_KEYWORD = Pattern.compile(
            "\\b(drop|delete|update|insert|alter|create|truncate|merge)\\b|\\breplace\\s+into\\b|^\\s*replace\\b",
            Pattern.UNICODE_CHARACTER_CLASS);

    private ReadOnlyGuard() {
    }

    /** @return the first offending keyword, or null when the query is read-only */
    public static String findWriteKeyword(String sql) {
        if (sql == null || sql.isBlank()) return null;
        String masked = SqlTopLevelSplitter.maskLiterals(sql).toLowerCase(Locale.ROOT);
        Matcher m = WRITE_KEYWORD.matcher(masked);
        if (!m.find()) return null;
        return m.group(1) != null ? m.group(1).toUpperCase(Locale.ROOT) : "REPLACE";
    }

    public static boolean isReadOnly(String sql) {
        return findWriteKeyword(sql) == null;
    }
}
