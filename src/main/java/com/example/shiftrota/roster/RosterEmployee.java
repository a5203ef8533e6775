package com.example.shiftrota.roster;

import java.util.Objects;

/**
 * Read-only snapshot of a team member as seen by the scheduler.
 *
 * @param seniorityLevel absolute company-wide level, lower is more senior
 */
public record RosterEmployee(Long id, String name, String designation, int seniorityLevel) {

    public RosterEmployee {
        Objects.requireNonNull(name, "name");
        designation = designation == null ? "" : designation;
    }

    Object identity() {
        return id != null ? id : name;
    }
}
