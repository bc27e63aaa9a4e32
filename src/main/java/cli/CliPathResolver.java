package cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Resolves evaluator input and output paths. Relative paths are taken against {@code baseDir}
 * (option or system property), else against the working directory; {@code ~/} expands to the user home.
 */
public final class CliPathResolver {

    public static final String PROP_BASE_DIR = "baseDir";

    private CliPathResolver() {}

    public static void applyBaseDirPropertyIfPresent(Map<String, String> argv) {
        String bd = (argv == null) ? null : trimToNull(argv.get(PROP_BASE_DIR));
        if (bd != null) System.setProperty(PROP_BASE_DIR, bd);
    }

    public static Path resolveBaseDir() {
        Path bd = expand(System.getProperty(PROP_BASE_DIR));
        return (bd != null ? bd : Paths.get(".")).toAbsolutePath().normalize();
    }

    public static Path resolvePath(Path baseDir, String input) {
        Path p = expand(input);
        if (p == null) return null;
        if (!p.isAbsolute() && baseDir != null) p = baseDir.resolve(p);
        return p.toAbsolutePath().normalize();
    }

    private static Path expand(String raw) {
        String t = trimToNull(raw);
        if (t == null) return null;
        if (t.equals("~") || t.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home")).resolve(t.substring(1).replaceFirst("^/", ""));
        }
        return Paths.get(t);
    }

    public static void validateFileExists(Path p, String label) {
        require(p, label, Files::isRegularFile, "file");
    }

    public static void validateDirExists(Path p, String label) {
        require(p, label, Files::isDirectory, "directory");
    }

    private static void require(Path p, String label, Predicate<Path> check, String kind) {
        if (p == null) throw new IllegalArgumentException(label + " is required");
        if (!check.test(p)) throw new IllegalArgumentException(label + " is not an existing " + kind + ": " + p);
    }

    public static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
