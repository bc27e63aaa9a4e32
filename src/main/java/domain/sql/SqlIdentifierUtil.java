package domain.sql;

/**
 * Small identifier helpers shared by the resolver, extractor and binder.
 */
public final class SqlIdentifierUtil {
    private SqlIdentifierUtil() {
    }

    public static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    public static String lastPart(String ident) {
        if (ident == null) return "";
        String t = ident.trim();
        int p = t.lastIndexOf('.');
        return (p >= 0) ? t.substring(p + 1) : t;
    }

    /** Strips one level of {@code "..."}, {@code `...`} or {@code [...]} quoting. */
    public static String unquote(String ident) {
        if (ident == null) return "";
        String t = ident.trim();
        if (t.length() >= 2) {
            char a = t.charAt(0);
            char b = t.charAt(t.length() - 1);
            if ((a == '"' && b == '"') || (a == '`' && b == '`') || (a == '[' && b == ']')) {
                return t.substring(1, t.length() - 1);
            }
        }
        return t;
    }
}
