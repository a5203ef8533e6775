package com.example.shiftrota.schedule;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One shift of one month: its fixed staff and the floaters backing it up.
 */
public record ShiftAssignment(
        @JsonProperty("assigned_staff") List<EmployeeRef> assignedStaff,
        @JsonProperty("floaters") List<EmployeeRef> floaters) {

    public ShiftAssignment {
        assignedStaff = assignedStaff == null ? List.of() : List.copyOf(assignedStaff);
        floaters = floaters == null ? List.of() : List.copyOf(floaters);
    }

    public static ShiftAssignment empty() {
        return new ShiftAssignment(List.of(), List.of());
    }
}
