package com.example.shiftrota.schedule.validation;

import com.example.shiftrota.schedule.EmployeeRef;
import com.example.shiftrota.schedule.Schedule;
import com.example.shiftrota.schedule.ShiftAssignment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Month-by-month (role, shift) history of every employee named in a schedule.
 * Positions follow the schedule's month order; a missing entry means the employee was not scheduled.
 */
final class ScheduleTimeline {

    enum Role { ASSIGNED, FLOATER }

    record Slot(Role role, String shift) {
    }

    private final List<String> months;
    private final Map<String, Slot[]> slotsByEmployee = new LinkedHashMap<>();
    private final Set<String> doubleBooked = new LinkedHashSet<>();

    private ScheduleTimeline(List<String> months) {
        this.months = months;
    }

    static ScheduleTimeline of(Schedule schedule) {
        ScheduleTimeline timeline = new ScheduleTimeline(schedule.monthLabels());
        for (int index = 0; index < timeline.months.size(); index++) {
            String month = timeline.months.get(index);
            for (Map.Entry<String, ShiftAssignment> shift : schedule.month(month).entrySet()) {
                for (EmployeeRef ref : shift.getValue().assignedStaff()) {
                    timeline.record(ref.name(), index, new Slot(Role.ASSIGNED, shift.getKey()));
                }
                for (EmployeeRef ref : shift.getValue().floaters()) {
                    timeline.record(ref.name(), index, new Slot(Role.FLOATER, shift.getKey()));
                }
            }
        }
        return timeline;
    }

    private void record(String employee, int index, Slot slot) {
        Slot[] slots = slotsByEmployee.computeIfAbsent(employee, k -> new Slot[months.size()]);
        if (slots[index] != null) {
            // first appearance in the month wins
            doubleBooked.add(employee + " in " + months.get(index));
            return;
        }
        slots[index] = slot;
    }

    List<String> months() {
        return months;
    }

    Set<String> employees() {
        return slotsByEmployee.keySet();
    }

    Slot[] slots(String employee) {
        return slotsByEmployee.get(employee);
    }

    List<String> doubleBooked() {
        return new ArrayList<>(doubleBooked);
    }
}
