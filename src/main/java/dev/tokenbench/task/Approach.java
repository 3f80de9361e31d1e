package dev.tokenbench.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The two competing approaches being benchmarked.
 *
 * <p>Declaration order is the execution order within a task: {@link #XL} always runs before {@link
 * #XLSX}.
 */
public enum Approach {
    /** Custom xl-cli skill with an uploaded xl binary. */
    XL("xl", "xl CLI"),
    /** Built-in xlsx skill (Python + openpyxl). */
    XLSX("xlsx", "Anthropic xlsx");

    private final String label;
    private final String displayName;

    Approach(String label, String displayName) {
        this.label = label;
        this.displayName = displayName;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String displayName() {
        return displayName;
    }

    @JsonCreator
    public static Approach fromLabel(String label) {
        for (var approach : values()) {
            if (approach.label.equalsIgnoreCase(label)) {
                return approach;
            }
        }
        throw new IllegalArgumentException("Unknown approach: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
