package com.example.shiftrota.schedule.validation;

import com.example.shiftrota.exception.ScheduleFormatException;
import com.example.shiftrota.roster.Roster;
import com.example.shiftrota.roster.RotationRules;
import com.example.shiftrota.schedule.EmployeeRef;
import com.example.shiftrota.schedule.MonthLabels;
import com.example.shiftrota.schedule.Schedule;
import com.example.shiftrota.schedule.ScheduleDocumentCodec;
import com.example.shiftrota.schedule.ShiftAssignment;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Replays a schedule against the rotation rules. Never mutates its input and never throws:
 * unusable input comes back as a single {@link RuleType#FORMAT} violation.
 */
@Component
public class ScheduleValidator {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleValidator.class);

    public ValidationReport validate(String json, Roster roster) {
        try {
            return validate(ScheduleDocumentCodec.read(json), roster);
        } catch (ScheduleFormatException e) {
            return formatError(e.getMessage());
        }
    }

    public ValidationReport validate(JsonNode document, Roster roster) {
        try {
            return validate(ScheduleDocumentCodec.fromTree(document), roster);
        } catch (ScheduleFormatException e) {
            return formatError(e.getMessage());
        }
    }

    public ValidationReport validate(Schedule schedule, Roster roster) {
        if (schedule == null || schedule.isEmpty()) {
            return formatError("schedule contains no months");
        }
        if (roster == null || roster.isEmpty()) {
            return formatError("no roster hierarchy available to validate against");
        }
        try {
            return check(schedule, roster);
        } catch (RuntimeException e) {
            logger.error("Validation failed on a schedule of {} month(s)", schedule.monthCount(), e);
            return formatError("schedule could not be checked: " + e.getMessage());
        }
    }

    private ValidationReport check(Schedule schedule, Roster roster) {
        ScheduleTimeline timeline = ScheduleTimeline.of(schedule);
        List<Violation> violations = new ArrayList<>();
        List<String> notes = new ArrayList<>();
        notes.add(String.format("Checked %d month(s) and %d employee(s).",
                timeline.months().size(), timeline.employees().size()));

        Set<String> unknown = new LinkedHashSet<>();
        for (String employee : timeline.employees()) {
            Optional<Integer> rank = roster.rankOfName(employee);
            if (rank.isEmpty()) {
                unknown.add(employee);
            } else {
                checkStability(employee, rank.get(), timeline, violations);
                checkFloaterExemption(employee, rank.get(), timeline, violations);
            }
            checkFloaterFairness(employee, timeline, violations);
        }
        checkCoverage(schedule, violations, notes);
        checkDiversity(schedule, roster, violations);

        if (!unknown.isEmpty()) {
            notes.add("Not in the team roster, rank-based checks skipped: " + String.join(", ", unknown) + ".");
        }
        List<String> doubleBooked = timeline.doubleBooked();
        if (!doubleBooked.isEmpty()) {
            notes.add("Listed more than once in a month (first entry used): " + String.join(", ", doubleBooked) + ".");
        }
        if (!roster.sharedNames().isEmpty()) {
            notes.add("Roster has more than one member named " + String.join(", ", roster.sharedNames())
                    + "; checked against the most senior of them.");
        }
        gapNote(timeline.months()).ifPresent(notes::add);

        logger.debug("Validation finished: {} violation(s)", violations.size());
        return ValidationReport.of(violations, String.join(" ", notes));
    }

    /**
     * One violation per maximal run on the same fixed shift that outlasts the rank's limit.
     */
    private void checkStability(String employee, int rank, ScheduleTimeline timeline, List<Violation> out) {
        ScheduleTimeline.Slot[] slots = timeline.slots(employee);
        int limit = RotationRules.stabilityMonths(rank);
        int runStart = -1;
        String runShift = null;
        for (int i = 0; i <= slots.length; i++) {
            ScheduleTimeline.Slot slot = i < slots.length ? slots[i] : null;
            boolean assigned = slot != null && slot.role() == ScheduleTimeline.Role.ASSIGNED;
            if (assigned && runShift != null && runShift.equals(slot.shift())) {
                continue;
            }
            if (runShift != null) {
                int length = i - runStart;
                if (RotationRules.exceedsStability(rank, length)) {
                    out.add(Violation.stability(employee, rank, runShift,
                            timeline.months().get(runStart), timeline.months().get(i - 1), length, limit));
                }
            }
            runStart = assigned ? i : -1;
            runShift = assigned ? slot.shift() : null;
        }
    }

    private void checkFloaterExemption(String employee, int rank, ScheduleTimeline timeline, List<Violation> out) {
        if (RotationRules.isFloaterEligible(rank)) {
            return;
        }
        ScheduleTimeline.Slot[] slots = timeline.slots(employee);
        for (int i = 0; i < slots.length; i++) {
            if (slots[i] != null && slots[i].role() == ScheduleTimeline.Role.FLOATER) {
                out.add(Violation.floaterExemption(employee, slots[i].shift(), timeline.months().get(i)));
            }
        }
    }

    // adjacency is by position in the schedule, reported once per employee
    private void checkFloaterFairness(String employee, ScheduleTimeline timeline, List<Violation> out) {
        ScheduleTimeline.Slot[] slots = timeline.slots(employee);
        for (int i = 1; i < slots.length; i++) {
            if (isFloater(slots[i - 1]) && isFloater(slots[i])) {
                out.add(Violation.floaterFairness(employee, timeline.months().get(i - 1), timeline.months().get(i)));
                return;
            }
        }
    }

    private void checkCoverage(Schedule schedule, List<Violation> out, List<String> notes) {
        Integer expected = null;
        for (String month : schedule.monthLabels()) {
            for (ShiftAssignment shift : schedule.month(month).values()) {
                if (expected == null && !shift.assignedStaff().isEmpty()) {
                    expected = shift.assignedStaff().size();
                }
            }
        }
        if (expected == null) {
            notes.add("No shift has assigned staff; coverage not checked.");
            return;
        }
        for (String month : schedule.monthLabels()) {
            for (Map.Entry<String, ShiftAssignment> shift : schedule.month(month).entrySet()) {
                int assigned = shift.getValue().assignedStaff().size();
                if (assigned != expected) {
                    out.add(Violation.coverage(shift.getKey(), month, assigned, expected));
                }
            }
        }
    }

    private void checkDiversity(Schedule schedule, Roster roster, List<Violation> out) {
        if (roster.rankCount() < 2) {
            return;
        }
        for (String month : schedule.monthLabels()) {
            for (Map.Entry<String, ShiftAssignment> shift : schedule.month(month).entrySet()) {
                List<Integer> ranks = shift.getValue().assignedStaff().stream()
                        .map(EmployeeRef::name)
                        .map(roster::rankOfName)
                        .flatMap(Optional::stream)
                        .toList();
                if (ranks.size() < 2) {
                    continue;
                }
                Set<Integer> distinct = ranks.stream().collect(Collectors.toSet());
                if (distinct.size() == 1) {
                    out.add(Violation.diversity(shift.getKey(), month, ranks.size(), ranks.get(0)));
                }
            }
        }
    }

    private static Optional<String> gapNote(List<String> months) {
        YearMonth previous = null;
        for (String label : months) {
            Optional<YearMonth> parsed = MonthLabels.parse(label);
            if (parsed.isEmpty()) {
                return Optional.of("Month label '" + label + "' is not in 'Month Year' form; months compared by position.");
            }
            if (previous != null && !parsed.get().equals(previous.plusMonths(1))) {
                return Optional.of("Months " + MonthLabels.format(previous) + " and " + label
                        + " are not consecutive; months compared by position.");
            }
            previous = parsed.get();
        }
        return Optional.empty();
    }

    private static boolean isFloater(ScheduleTimeline.Slot slot) {
        return slot != null && slot.role() == ScheduleTimeline.Role.FLOATER;
    }

    private static ValidationReport formatError(String detail) {
        logger.warn("Schedule rejected as malformed: {}", detail);
        return ValidationReport.of(List.of(Violation.format(detail)), "Schedule could not be validated.");
    }
}
