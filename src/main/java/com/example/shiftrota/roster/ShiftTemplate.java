package com.example.shiftrota.roster;

import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

public enum ShiftTemplate {
    THREE_SHIFT("3-shift", EnumSet.of(ShiftName.MORNING, ShiftName.AFTERNOON, ShiftName.NIGHT)),
    FOUR_SHIFT("4-shift", EnumSet.of(ShiftName.MORNING, ShiftName.AFTERNOON, ShiftName.EVENING, ShiftName.NIGHT)),
    FIVE_SHIFT("5-shift", EnumSet.allOf(ShiftName.class));

    private final String code;
    private final EnumSet<ShiftName> shifts;

    ShiftTemplate(String code, EnumSet<ShiftName> shifts) {
        this.code = code;
        this.shifts = shifts;
    }

    public String code() {
        return code;
    }

    /**
     * Shifts of this template in canonical catalog order.
     */
    public List<ShiftName> shifts() {
        return List.copyOf(shifts);
    }

    /**
     * Shifts of this template ordered from most to least desirable.
     */
    public List<ShiftName> byDesirability() {
        return shifts.stream()
                .sorted(Comparator.comparingInt(ShiftName::desirability))
                .toList();
    }

    public int shiftCount() {
        return shifts.size();
    }

    public static Optional<ShiftTemplate> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String trimmed = code.trim();
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
