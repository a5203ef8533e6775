package com.example.shiftrota.roster;

import java.util.Arrays;
import java.util.Optional;

/**
 * Fixed shift catalog. Declaration order is the canonical output order of a schedule month.
 */
public enum ShiftName {
    EARLY_MORNING("Early Morning", 5),
    MORNING("Morning", 1),
    AFTERNOON("Afternoon", 2),
    EVENING("Evening", 3),
    NIGHT("Night", 4);

    private final String displayName;
    private final int desirability;

    ShiftName(String displayName, int desirability) {
        this.displayName = displayName;
        this.desirability = desirability;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Lower is more desirable. Used as the processing order when filling shifts.
     */
    public int desirability() {
        return desirability;
    }

    public static Optional<ShiftName> fromDisplayName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(s -> s.displayName.equalsIgnoreCase(trimmed))
                .findFirst();
    }

    @Override
    public String toString() {
        return displayName;
    }
}
