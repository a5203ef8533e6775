package com.example.shiftrota.schedule;

import com.example.shiftrota.roster.RosterEmployee;

public record EmployeeRef(String name, String designation) {

    public EmployeeRef {
        designation = designation == null ? "" : designation;
    }

    public static EmployeeRef of(RosterEmployee employee) {
        return new EmployeeRef(employee.name(), employee.designation());
    }
}
