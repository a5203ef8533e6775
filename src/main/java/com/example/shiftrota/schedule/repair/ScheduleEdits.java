package com.example.shiftrota.schedule.repair;

import com.example.shiftrota.schedule.EmployeeRef;
import com.example.shiftrota.schedule.Schedule;
import com.example.shiftrota.schedule.ShiftAssignment;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Single-month edits on an immutable {@link Schedule}. Employees are matched by name.
 */
final class ScheduleEdits {

    private ScheduleEdits() {
    }

    static Schedule swapAssigned(Schedule schedule, String month,
                                 String first, String firstShift,
                                 String second, String secondShift) {
        ShiftAssignment a = schedule.shift(month, firstShift).orElseThrow();
        ShiftAssignment b = schedule.shift(month, secondShift).orElseThrow();
        EmployeeRef firstRef = find(a.assignedStaff(), first).orElseThrow();
        EmployeeRef secondRef = find(b.assignedStaff(), second).orElseThrow();
        Schedule edited = schedule.withShift(month, firstShift,
                new ShiftAssignment(replace(a.assignedStaff(), first, secondRef), a.floaters()));
        ShiftAssignment target = edited.shift(month, secondShift).orElseThrow();
        return edited.withShift(month, secondShift,
                new ShiftAssignment(replace(target.assignedStaff(), second, firstRef), target.floaters()));
    }

    /**
     * The floater takes the assignee's fixed slot and the assignee floats on the floater's shift.
     */
    static Schedule swapRoles(Schedule schedule, String month,
                              String floater, String floaterShift,
                              String assignee, String assigneeShift) {
        ShiftAssignment floaterSide = schedule.shift(month, floaterShift).orElseThrow();
        ShiftAssignment assigneeSide = schedule.shift(month, assigneeShift).orElseThrow();
        EmployeeRef floaterRef = find(floaterSide.floaters(), floater).orElseThrow();
        EmployeeRef assigneeRef = find(assigneeSide.assignedStaff(), assignee).orElseThrow();
        Schedule edited = schedule.withShift(month, floaterShift,
                new ShiftAssignment(floaterSide.assignedStaff(), replace(floaterSide.floaters(), floater, assigneeRef)));
        ShiftAssignment target = edited.shift(month, assigneeShift).orElseThrow();
        return edited.withShift(month, assigneeShift,
                new ShiftAssignment(replace(target.assignedStaff(), assignee, floaterRef), target.floaters()));
    }

    static Schedule move(Schedule schedule, String month, String employee, String fromShift, String toShift) {
        ShiftAssignment from = schedule.shift(month, fromShift).orElseThrow();
        EmployeeRef ref = find(from.assignedStaff(), employee).orElseThrow();
        List<EmployeeRef> remaining = new ArrayList<>(from.assignedStaff());
        remaining.remove(ref);
        Schedule edited = schedule.withShift(month, fromShift, new ShiftAssignment(remaining, from.floaters()));
        ShiftAssignment to = edited.shift(month, toShift).orElseThrow();
        List<EmployeeRef> added = new ArrayList<>(to.assignedStaff());
        added.add(ref);
        return edited.withShift(month, toShift, new ShiftAssignment(added, to.floaters()));
    }

    static Optional<EmployeeRef> find(List<EmployeeRef> people, String name) {
        return people.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    private static List<EmployeeRef> replace(List<EmployeeRef> people, String name, EmployeeRef replacement) {
        List<EmployeeRef> result = new ArrayList<>(people);
        for (int i = 0; i < result.size(); i++) {
            if (result.get(i).name().equals(name)) {
                result.set(i, replacement);
                return result;
            }
        }
        throw new IllegalArgumentException(name + " is not listed");
    }
}
