package com.example.shiftrota.oracle;

/**
 * Plain-language statement of the rotation rules, sent along with a schedule to the oracle.
 */
public final class SchedulingRules {

    public static final String TEXT = """
            Ranks are relative to the team: rank 1 is the most senior designation present.
            Rule 1 (Stability): rank 1 may stay on the same shift for at most 3 consecutive months, \
            rank 2 for at most 2, every other rank for 1 month before moving to a different shift.
            Rule 2 (Floater Exemption): rank 1 employees are never floaters.
            Rule 3 (Floater Fairness): nobody is a floater in two consecutive months.
            Every shift of a month has the same number of assigned staff.
            When a team has more than one rank, a shift with several assigned staff should not be all one rank.
            """;

    private SchedulingRules() {
    }
}
