package com.example.shiftrota.schedule.validation;

import java.util.List;

/**
 * One broken rule with enough evidence to act on it without rebuilding the timeline.
 *
 * @param months   offending month labels in schedule order (run start and end for stability)
 * @param measured run length or headcount, when the rule measures one
 * @param limit    allowed value, when the rule has one
 */
public record Violation(
        RuleType rule,
        String employee,
        String shift,
        List<String> months,
        Integer measured,
        Integer limit,
        String message) {

    public Violation {
        months = months == null ? List.of() : List.copyOf(months);
    }

    public boolean isCore() {
        return rule.isCore();
    }

    static Violation stability(String employee, int rank, String shift, String startMonth, String endMonth,
                               int runLength, int limit) {
        String message = String.format(
                "%s: %s (rank %d) stayed on %s for %d consecutive months from %s to %s; limit is %d month(s)",
                RuleType.STABILITY.label(), employee, rank, shift, runLength, startMonth, endMonth, limit);
        return new Violation(RuleType.STABILITY, employee, shift, List.of(startMonth, endMonth),
                runLength, limit, message);
    }

    static Violation floaterExemption(String employee, String shift, String month) {
        String message = String.format("%s: %s (rank 1) is a floater on %s in %s; rank 1 is exempt from floater duty",
                RuleType.FLOATER_EXEMPTION.label(), employee, shift, month);
        return new Violation(RuleType.FLOATER_EXEMPTION, employee, shift, List.of(month), null, null, message);
    }

    static Violation floaterFairness(String employee, String firstMonth, String secondMonth) {
        String message = String.format("%s: %s is a floater in consecutive months %s and %s",
                RuleType.FLOATER_FAIRNESS.label(), employee, firstMonth, secondMonth);
        return new Violation(RuleType.FLOATER_FAIRNESS, employee, null, List.of(firstMonth, secondMonth),
                null, null, message);
    }

    static Violation coverage(String shift, String month, int assigned, int expected) {
        String message = String.format("%s: %s in %s has %d assigned staff, expected %d",
                RuleType.COVERAGE.label(), shift, month, assigned, expected);
        return new Violation(RuleType.COVERAGE, null, shift, List.of(month), assigned, expected, message);
    }

    static Violation diversity(String shift, String month, int members, int rank) {
        String message = String.format("%s: all %d assigned staff on %s in %s are rank %d",
                RuleType.DIVERSITY.label(), members, shift, month, rank);
        return new Violation(RuleType.DIVERSITY, null, shift, List.of(month), members, null, message);
    }

    static Violation format(String detail) {
        return new Violation(RuleType.FORMAT, null, null, List.of(), null, null,
                RuleType.FORMAT.label() + ": " + detail);
    }

    @Override
    public String toString() {
        return message;
    }
}
