package com.example.shiftrota.schedule.generation;

import com.example.shiftrota.exception.ScheduleGenerationException;
import com.example.shiftrota.roster.Roster;
import com.example.shiftrota.roster.RosterEmployee;
import com.example.shiftrota.roster.ShiftName;
import com.example.shiftrota.roster.ShiftTemplate;
import com.example.shiftrota.roster.TeamConfiguration;
import com.example.shiftrota.schedule.EmployeeRef;
import com.example.shiftrota.schedule.MonthLabels;
import com.example.shiftrota.schedule.Schedule;
import com.example.shiftrota.schedule.ShiftAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Monthly allocation loop. For every simulated month: pick floaters, spread them over the
 * shifts, split everyone else into fixed shift teams, then advance each employee's history.
 * <p>
 * Stateless between calls; all per-employee history is local to one {@link #generate} call.
 */
@Component
public class AssignmentGenerator {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentGenerator.class);

    private final Clock clock;
    private final int maxAttempts;

    public AssignmentGenerator(Clock clock,
                               @Value("${rotation.generation.max-attempts:25}") int maxAttempts) {
        this.clock = clock;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Generates {@code months} months starting with the current calendar month.
     */
    public GenerationResult generate(TeamConfiguration configuration, Roster roster, int months, long seed) {
        return generate(configuration, roster, months, seed, YearMonth.now(clock));
    }

    public GenerationResult generate(TeamConfiguration configuration,
                                     Roster roster,
                                     int months,
                                     long seed,
                                     YearMonth firstMonth) {
        ShiftTemplate template = checkConfiguration(configuration, roster, months);
        int peoplePerShift = configuration.peoplePerShift();
        List<ShiftName> processingOrder = template.byDesirability();
        int requiredFixed = template.shiftCount() * peoplePerShift;
        boolean multiRankTeam = roster.rankCount() > 1;

        logger.info("Generating {} month(s) for team '{}' from {}: roster={}, template={}, perShift={}, seed={}",
                months, configuration.name(), firstMonth, roster.size(), template.code(), peoplePerShift, seed);

        Random random = new Random(seed);
        FixedStaffAssigner assigner = new FixedStaffAssigner(maxAttempts);
        Map<RosterEmployee, EmployeeMonthlyState> states = new LinkedHashMap<>();
        for (RosterEmployee employee : roster.employees()) {
            states.put(employee, new EmployeeMonthlyState(roster.rankOf(employee)));
        }

        Schedule.Builder schedule = Schedule.builder();
        List<MonthDiagnostics> diagnostics = new ArrayList<>();
        for (int index = 0; index < months; index++) {
            String label = MonthLabels.format(firstMonth.plusMonths(index));

            int floatersRequired = Math.max(0, roster.size() - requiredFixed);
            FloaterSelector.Selection selection = FloaterSelector.select(roster, states, floatersRequired);
            List<RosterEmployee> floaters = selection.floaters();
            Set<RosterEmployee> floaterSet = new HashSet<>(floaters);
            for (Map.Entry<RosterEmployee, EmployeeMonthlyState> entry : states.entrySet()) {
                if (floaterSet.contains(entry.getKey())) {
                    entry.getValue().markFloater();
                } else {
                    entry.getValue().markNotFloater();
                }
            }
            if (!selection.backfilled().isEmpty()) {
                logger.warn("{}: only {} fresh floater candidate(s) for {} slot(s), reusing {} from last month",
                        label, floaters.size() - selection.backfilled().size(), floatersRequired,
                        names(selection.backfilled()));
            }

            Map<ShiftName, List<RosterEmployee>> floaterMap = new LinkedHashMap<>();
            for (ShiftName shift : processingOrder) {
                floaterMap.put(shift, new ArrayList<>());
            }
            for (int i = 0; i < floaters.size(); i++) {
                floaterMap.get(processingOrder.get(i % processingOrder.size())).add(floaters.get(i));
            }

            List<RosterEmployee> pool = roster.employees().stream()
                    .filter(e -> !floaterSet.contains(e))
                    .toList();
            FixedStaffAssigner.Result fixed = assigner.assign(
                    pool, processingOrder, peoplePerShift, multiRankTeam, states, random);
            if (fixed.roundRobinFallback()) {
                logger.warn("{}: no balanced assignment after {} attempt(s), falling back to round-robin",
                        label, fixed.attempts());
            }
            fixed.teams().forEach((shift, team) -> team.forEach(member -> states.get(member).assign(shift)));

            Map<String, ShiftAssignment> shifts = new LinkedHashMap<>();
            for (ShiftName shift : template.shifts()) {
                shifts.put(shift.displayName(), new ShiftAssignment(
                        refs(fixed.teams().get(shift)),
                        refs(floaterMap.get(shift))));
            }
            schedule.month(label, shifts);

            boolean overflow = pool.size() > requiredFixed;
            diagnostics.add(new MonthDiagnostics(label, floatersRequired, names(floaters),
                    names(selection.backfilled()), fixed.attempts(), fixed.roundRobinFallback(), overflow));
            logger.debug("{}: floaters={}, attempts={}, overflow={}", label, names(floaters), fixed.attempts(), overflow);
        }

        GenerationResult result = new GenerationResult(schedule.build(), seed, diagnostics);
        logger.info("Generated {} month(s) for team '{}'", result.schedule().monthCount(), configuration.name());
        return result;
    }

    private ShiftTemplate checkConfiguration(TeamConfiguration configuration, Roster roster, int months) {
        if (roster == null || roster.isEmpty()) {
            throw new ScheduleGenerationException(ScheduleGenerationException.EMPTY_ROSTER,
                    "No employees in team '" + configuration.name() + "'.");
        }
        ShiftTemplate template = configuration.template()
                .orElseThrow(() -> new ScheduleGenerationException(ScheduleGenerationException.UNKNOWN_TEMPLATE,
                        "Team '" + configuration.name() + "' has an invalid shift template configured: "
                                + configuration.shiftTemplate(), configuration.shiftTemplate()));
        if (configuration.peoplePerShift() < 1) {
            throw new ScheduleGenerationException(ScheduleGenerationException.INVALID_PEOPLE_PER_SHIFT,
                    "People per shift must be 1 or greater.", configuration.peoplePerShift());
        }
        if (months < 1) {
            throw new ScheduleGenerationException(ScheduleGenerationException.INVALID_MONTHS,
                    "Number of months must be 1 or greater.", months);
        }
        int required = template.shiftCount() * configuration.peoplePerShift();
        if (roster.size() < required) {
            throw new ScheduleGenerationException(ScheduleGenerationException.INSUFFICIENT_HEADCOUNT,
                    "A minimum of " + required + " employees is required for " + template.code() + " with "
                            + configuration.peoplePerShift() + " people per shift; team has " + roster.size() + ".",
                    required, roster.size());
        }
        return template;
    }

    private static List<EmployeeRef> refs(List<RosterEmployee> employees) {
        if (employees == null) {
            return List.of();
        }
        return employees.stream().map(EmployeeRef::of).toList();
    }

    private static List<String> names(List<RosterEmployee> employees) {
        return employees.stream().map(RosterEmployee::name).toList();
    }
}
