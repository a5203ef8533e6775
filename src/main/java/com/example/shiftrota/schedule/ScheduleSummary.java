package com.example.shiftrota.schedule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-employee totals over a schedule, in order of first appearance.
 */
public record ScheduleSummary(Long teamId, int months, List<EmployeeSummary> employees) {

    public record EmployeeSummary(String name,
                                  String designation,
                                  int assignedMonths,
                                  int floaterMonths,
                                  Map<String, Integer> shiftCounts) {
    }

    public static ScheduleSummary of(Long teamId, Schedule schedule) {
        Map<String, Counter> counters = new LinkedHashMap<>();
        for (String month : schedule.monthLabels()) {
            for (Map.Entry<String, ShiftAssignment> shift : schedule.month(month).entrySet()) {
                for (EmployeeRef ref : shift.getValue().assignedStaff()) {
                    Counter counter = counters.computeIfAbsent(ref.name(), n -> new Counter(ref.designation()));
                    counter.assigned++;
                    counter.shifts.merge(shift.getKey(), 1, Integer::sum);
                }
                for (EmployeeRef ref : shift.getValue().floaters()) {
                    counters.computeIfAbsent(ref.name(), n -> new Counter(ref.designation())).floater++;
                }
            }
        }
        List<EmployeeSummary> employees = counters.entrySet().stream()
                .map(e -> new EmployeeSummary(e.getKey(), e.getValue().designation,
                        e.getValue().assigned, e.getValue().floater, Collections.unmodifiableMap(e.getValue().shifts)))
                .toList();
        return new ScheduleSummary(teamId, schedule.monthCount(), employees);
    }

    private static final class Counter {
        private final String designation;
        private final Map<String, Integer> shifts = new LinkedHashMap<>();
        private int assigned;
        private int floater;

        private Counter(String designation) {
            this.designation = designation;
        }
    }
}
