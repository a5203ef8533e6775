package com.example.shiftrota.schedule;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Month label (e.g. "March 2025") to shift name to {@link ShiftAssignment}, in insertion order.
 * Immutable; edits return a new instance.
 */
public final class Schedule {

    private static final Schedule EMPTY = new Schedule(new LinkedHashMap<>());

    private final Map<String, Map<String, ShiftAssignment>> months;

    private Schedule(LinkedHashMap<String, Map<String, ShiftAssignment>> months) {
        this.months = Collections.unmodifiableMap(months);
    }

    public static Schedule empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonValue
    public Map<String, Map<String, ShiftAssignment>> asMap() {
        return months;
    }

    public List<String> monthLabels() {
        return List.copyOf(months.keySet());
    }

    public int monthCount() {
        return months.size();
    }

    public boolean isEmpty() {
        return months.isEmpty();
    }

    public Map<String, ShiftAssignment> month(String label) {
        Map<String, ShiftAssignment> shifts = months.get(label);
        return shifts == null ? Map.of() : shifts;
    }

    public Optional<ShiftAssignment> shift(String monthLabel, String shiftName) {
        return Optional.ofNullable(month(monthLabel).get(shiftName));
    }

    /**
     * Returns a copy with one shift of one month replaced. Month and shift keys keep their order.
     */
    public Schedule withShift(String monthLabel, String shiftName, ShiftAssignment assignment) {
        if (!months.containsKey(monthLabel)) {
            throw new IllegalArgumentException("Unknown month: " + monthLabel);
        }
        Builder builder = new Builder();
        months.forEach((label, shifts) -> {
            Map<String, ShiftAssignment> copy = new LinkedHashMap<>(shifts);
            if (label.equals(monthLabel)) {
                copy.put(shiftName, assignment);
            }
            builder.month(label, copy);
        });
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Schedule other)) return false;
        return months.equals(other.months);
    }

    @Override
    public int hashCode() {
        return Objects.hash(months);
    }

    @Override
    public String toString() {
        return "Schedule" + months;
    }

    public static final class Builder {
        private final LinkedHashMap<String, Map<String, ShiftAssignment>> months = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder month(String label, Map<String, ShiftAssignment> shifts) {
            Objects.requireNonNull(label, "label");
            months.put(label, Collections.unmodifiableMap(new LinkedHashMap<>(shifts)));
            return this;
        }

        public Schedule build() {
            return new Schedule(new LinkedHashMap<>(months));
        }
    }
}
