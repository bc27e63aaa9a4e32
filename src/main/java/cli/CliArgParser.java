package cli;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Option parsing for the evaluator command line.
 * Malformed numeric values fall back to the default and are logged, so a typo never aborts a long run.
 */
public final class CliArgParser {

    private static final Logger log = LoggerFactory.getLogger(CliArgParser.class);

    private static final Set<String> TRUE_WORDS = Set.of("true", "1", "y", "yes", "on");

    private CliArgParser() {
    }

    public static int parseInt(String s, int def) {
        return parseNumber(s, def, Integer::valueOf);
    }

    public static long parseLong(String s, long def) {
        return parseNumber(s, def, Long::valueOf);
    }

    private static <N extends Number> N parseNumber(String s, N def, Function<String, N> parser) {
        if (s == null || s.isBlank()) return def;
        try {
            return parser.apply(s.trim());
        } catch (NumberFormatException e) {
            log.warn("[CONF] not a number: '{}', using default {}", s, def);
            return def;
        }
    }

    public static boolean parseBoolean(String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        return TRUE_WORDS.contains(s.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Presence-style flag: {@code --execute} and {@code --execute=true} are on,
     * {@code --execute=false} is off, absence is off.
     */
    public static boolean flag(Map<String, String> argv, String key) {
        if (argv == null || key == null || !argv.containsKey(key)) return false;
        return parseBoolean(argv.get(key), true);
    }

    /** Logs every option outside {@code known}; misspelled options are otherwise silently ignored. */
    public static void warnUnknown(Map<String, String> argv, Set<String> known) {
        if (argv == null) return;
        for (String k : argv.keySet()) {
            if (!known.contains(k)) log.warn("[CONF] unknown option --{} (ignored)", k);
        }
    }

    /** {@code --key=value}, {@code --key value} or bare {@code --key}. Positional tokens are ignored. */
    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new LinkedHashMap<>();
        if (args == null) return m;

        int i = 0;
        while (i < args.length) {
            String a = args[i++] == null ? "" : args[i - 1].trim();
            if (!a.startsWith("--")) continue;

            String body = a.substring(2);
            int eq = body.indexOf('=');
            if (eq > 0) {
                put(m, body.substring(0, eq), body.substring(eq + 1));
                continue;
            }

            String v = "";
            if (i < args.length && args[i] != null && !args[i].startsWith("--")) {
                v = args[i++];
            }
            put(m, body, v);
        }
        return m;
    }

    private static void put(Map<String, String> m, String key, String value) {
        String k = key.trim();
        if (!k.isEmpty()) m.put(k, value.trim());
    }
}
