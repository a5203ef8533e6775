package com.example.shiftrota.schedule.repair;

import com.example.shiftrota.roster.Roster;
import com.example.shiftrota.roster.RotationRules;
import com.example.shiftrota.schedule.EmployeeRef;
import com.example.shiftrota.schedule.Schedule;
import com.example.shiftrota.schedule.ShiftAssignment;
import com.example.shiftrota.schedule.validation.RuleType;
import com.example.shiftrota.schedule.validation.ScheduleValidator;
import com.example.shiftrota.schedule.validation.ValidationReport;
import com.example.shiftrota.schedule.validation.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Local search over single-month edits. Each pass re-validates every candidate edit for the
 * remaining core violations and keeps the one that helps most; a pass that finds nothing ends
 * the search. Coverage and diversity violations are never targeted, but an edit that adds
 * any is not taken.
 */
@Component
public class ScheduleRepairer {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleRepairer.class);

    static final String NOTHING_TO_REPAIR = "No core violations to repair.";
    static final String NOT_IMPROVED = "No change reduced the core violations; schedule left as is.";
    static final String DEADLINE_EXPIRED = "Repair deadline expired; schedule left as is.";

    private final ScheduleValidator validator;
    private final Clock clock;
    private final int maxPasses;
    private final Duration timeout;

    public ScheduleRepairer(ScheduleValidator validator,
                            Clock clock,
                            @Value("${rotation.repair.max-passes:50}") int maxPasses,
                            @Value("${rotation.repair.timeout:PT10S}") Duration timeout) {
        this.validator = validator;
        this.clock = clock;
        this.maxPasses = maxPasses;
        this.timeout = timeout;
    }

    public RepairResult repair(Schedule schedule, List<String> violations, Roster roster) {
        return repair(schedule, violations, roster, clock.instant().plus(timeout));
    }

    /**
     * @param violations messages from an earlier validation; only the core ones are acted on
     * @param deadline   on expiry the input comes back unchanged with its core violations as remaining
     */
    public RepairResult repair(Schedule schedule, List<String> violations, Roster roster, Instant deadline) {
        List<String> targeted = violations == null ? List.of() : violations.stream()
                .filter(RuleType::isCoreMessage)
                .toList();
        if (targeted.isEmpty()) {
            return RepairResult.unchanged(schedule, List.of(), NOTHING_TO_REPAIR);
        }

        Score baseline = Score.of(validator.validate(schedule, roster));
        Schedule current = schedule;
        Score currentScore = baseline;
        List<ScheduleChange> changes = new ArrayList<>();
        int passes = 0;
        while (passes < maxPasses && currentScore.core() > 0) {
            if (expired(deadline)) {
                logger.warn("Repair stopped after {} pass(es): deadline expired", passes);
                return RepairResult.unchanged(schedule, targeted, DEADLINE_EXPIRED);
            }
            passes++;
            Candidate best = null;
            for (Candidate candidate : candidates(current, currentScore.report(), roster)) {
                if (expired(deadline)) {
                    break;
                }
                Score score = Score.of(validator.validate(candidate.schedule(), roster));
                if (score.improves(currentScore) && (best == null || score.ranksAbove(best.score()))) {
                    best = candidate.scored(score);
                }
            }
            if (best == null) {
                break;
            }
            logger.debug("Pass {}: {} -> core {} (was {})", passes, best.change(), best.score().core(),
                    currentScore.core());
            current = best.schedule();
            currentScore = best.score();
            changes.add(best.change());
        }

        // monotonicity guard against stale input messages
        if (changes.isEmpty() || currentScore.core() > targeted.size()) {
            List<String> remaining = baseline.coreMessages().isEmpty() ? targeted : baseline.coreMessages();
            logger.info("Repair made no improvement; {} core violation(s) remain", remaining.size());
            return new RepairResult(schedule, List.of(), List.of(), remaining, NOT_IMPROVED, true);
        }

        Set<String> after = new HashSet<>(currentScore.coreMessages());
        Set<String> before = new LinkedHashSet<>(targeted);
        before.addAll(baseline.coreMessages());
        List<String> fixed = before.stream().filter(m -> !after.contains(m)).toList();
        List<String> remaining = currentScore.coreMessages();
        String message = String.format("Applied %d change(s); fixed %d violation(s), %d remaining.",
                changes.size(), fixed.size(), remaining.size());
        logger.info("Repair finished in {} pass(es): {}", passes, message);
        return new RepairResult(current, changes, fixed, remaining, message, true);
    }

    private List<Candidate> candidates(Schedule schedule, ValidationReport report, Roster roster) {
        List<Candidate> out = new ArrayList<>();
        for (Violation violation : report.coreViolations()) {
            switch (violation.rule()) {
                case STABILITY -> stabilityCandidates(schedule, violation, roster, out);
                case FLOATER_EXEMPTION -> roleSwapCandidates(schedule, violation.employee(),
                        violation.months().get(0), roster, out);
                case FLOATER_FAIRNESS -> {
                    for (String month : violation.months()) {
                        roleSwapCandidates(schedule, violation.employee(), month, roster, out);
                    }
                }
                default -> {
                }
            }
        }
        return out;
    }

    /**
     * Breaks the run at any of its months: swap with a colleague on another shift,
     * trade places with a floater, or move to another shift outright.
     */
    private void stabilityCandidates(Schedule schedule, Violation violation, Roster roster, List<Candidate> out) {
        String employee = violation.employee();
        String shift = violation.shift();
        List<String> labels = schedule.monthLabels();
        int start = labels.indexOf(violation.months().get(0));
        int end = labels.indexOf(violation.months().get(1));
        if (start < 0 || end < start) {
            return;
        }
        for (int i = start; i <= end; i++) {
            String month = labels.get(i);
            for (Map.Entry<String, ShiftAssignment> other : schedule.month(month).entrySet()) {
                if (other.getKey().equals(shift)) {
                    continue;
                }
                for (EmployeeRef colleague : other.getValue().assignedStaff()) {
                    out.add(new Candidate(
                            ScheduleEdits.swapAssigned(schedule, month, employee, shift, colleague.name(), other.getKey()),
                            ScheduleChange.swap(employee, month, shift, other.getKey(), colleague.name()), null));
                }
                for (EmployeeRef floater : other.getValue().floaters()) {
                    if (floaterEligible(floater.name(), roster)) {
                        out.add(new Candidate(
                                ScheduleEdits.swapRoles(schedule, month, floater.name(), other.getKey(), employee, shift),
                                ScheduleChange.roleSwap(floater.name(), month, other.getKey(), employee, shift), null));
                    }
                }
                out.add(new Candidate(
                        ScheduleEdits.move(schedule, month, employee, shift, other.getKey()),
                        ScheduleChange.move(employee, month, shift, other.getKey()), null));
            }
            ShiftAssignment own = schedule.shift(month, shift).orElse(ShiftAssignment.empty());
            for (EmployeeRef floater : own.floaters()) {
                if (floaterEligible(floater.name(), roster)) {
                    out.add(new Candidate(
                            ScheduleEdits.swapRoles(schedule, month, floater.name(), shift, employee, shift),
                            ScheduleChange.roleSwap(floater.name(), month, shift, employee, shift), null));
                }
            }
        }
    }

    /**
     * The floater takes some assigned employee's place in that month and the assignee floats instead.
     */
    private void roleSwapCandidates(Schedule schedule, String floater, String month, Roster roster,
                                    List<Candidate> out) {
        String floaterShift = null;
        for (Map.Entry<String, ShiftAssignment> shift : schedule.month(month).entrySet()) {
            if (ScheduleEdits.find(shift.getValue().floaters(), floater).isPresent()) {
                floaterShift = shift.getKey();
                break;
            }
        }
        if (floaterShift == null) {
            return;
        }
        for (Map.Entry<String, ShiftAssignment> shift : schedule.month(month).entrySet()) {
            for (EmployeeRef assignee : shift.getValue().assignedStaff()) {
                if (assignee.name().equals(floater) || !floaterEligible(assignee.name(), roster)) {
                    continue;
                }
                out.add(new Candidate(
                        ScheduleEdits.swapRoles(schedule, month, floater, floaterShift, assignee.name(), shift.getKey()),
                        ScheduleChange.roleSwap(floater, month, floaterShift, assignee.name(), shift.getKey()), null));
            }
        }
    }

    private static boolean floaterEligible(String name, Roster roster) {
        return roster.rankOfName(name).map(RotationRules::isFloaterEligible).orElse(false);
    }

    private boolean expired(Instant deadline) {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    private record Candidate(Schedule schedule, ScheduleChange change, Score score) {
        Candidate scored(Score score) {
            return new Candidate(schedule, change, score);
        }
    }

    /**
     * Ordering used to compare schedules: fewer core violations, then a lower total overshoot
     * of stability limits, then fewer non-core violations. Non-core may never grow.
     */
    private record Score(ValidationReport report, int core, int severity, int nonCore) {

        static Score of(ValidationReport report) {
            int severity = 0;
            for (Violation v : report.coreViolations()) {
                if (v.rule() == RuleType.STABILITY && v.measured() != null && v.limit() != null) {
                    severity += v.measured() - v.limit();
                } else {
                    severity++;
                }
            }
            return new Score(report, report.coreCount(), severity, report.nonCoreCount());
        }

        boolean improves(Score other) {
            return nonCore <= other.nonCore && ranksAbove(other);
        }

        boolean ranksAbove(Score other) {
            if (core != other.core) {
                return core < other.core;
            }
            if (severity != other.severity) {
                return severity < other.severity;
            }
            return nonCore < other.nonCore;
        }

        List<String> coreMessages() {
            return report.coreViolations().stream().map(Violation::message).toList();
        }
    }
}
