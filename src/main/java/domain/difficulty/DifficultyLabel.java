package domain.difficulty;

import java.util.Locale;

public enum DifficultyLabel {
    EASY,
    MEDIUM,
    HARD,
    EXTRA;

    /** Lower-case name used in reports. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
