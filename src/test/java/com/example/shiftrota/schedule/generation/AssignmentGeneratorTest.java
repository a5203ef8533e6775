package com.example.shiftrota.schedule.generation;

import com.example.shiftrota.TestRosters;
import com.example.shiftrota.exception.ScheduleGenerationException;
import com.example.shiftrota.roster.Roster;
import com.example.shiftrota.roster.RosterEmployee;
import com.example.shiftrota.roster.ShiftName;
import com.example.shiftrota.roster.TeamConfiguration;
import com.example.shiftrota.schedule.EmployeeRef;
import com.example.shiftrota.schedule.MonthLabels;
import com.example.shiftrota.schedule.Schedule;
import com.example.shiftrota.schedule.ShiftAssignment;
import com.example.shiftrota.schedule.validation.RuleType;
import com.example.shiftrota.schedule.validation.ScheduleValidator;
import com.example.shiftrota.schedule.validation.ValidationReport;
import com.example.shiftrota.schedule.validation.Violation;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.example.shiftrota.TestRosters.employee;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssignmentGeneratorTest {

    private static final YearMonth START = YearMonth.of(2025, 1);

    private final Clock clock = Clock.fixed(Instant.parse("2025-03-15T00:00:00Z"), ZoneOffset.UTC);
    private final AssignmentGenerator generator = new AssignmentGenerator(clock, 25);
    private final ScheduleValidator validator = new ScheduleValidator();

    @Test
    void generate_returnsRequestedMonthsInCalendarOrder() {
        Schedule schedule = generator.generate(TestRosters.threeShift(2), TestRosters.demo(), 6, 7L, START).schedule();

        assertThat(schedule.monthLabels()).hasSize(6);
        YearMonth expected = START;
        for (String label : schedule.monthLabels()) {
            assertThat(MonthLabels.parse(label)).contains(expected);
            expected = expected.plusMonths(1);
        }
    }

    @Test
    void generate_startsAtCurrentMonthOfClock() {
        Schedule schedule = generator.generate(TestRosters.threeShift(2), TestRosters.demo(), 2, 1L).schedule();

        assertThat(schedule.monthLabels()).containsExactly("March 2025", "April 2025");
    }

    @Test
    void generate_wrapsIntoNextYear() {
        Schedule schedule = generator.generate(TestRosters.threeShift(2), TestRosters.demo(), 3, 5L,
                YearMonth.of(2025, 11)).schedule();

        assertThat(schedule.monthLabels()).containsExactly("November 2025", "December 2025", "January 2026");
    }

    @Test
    void demoTeam_yearLongScheduleKeepsStabilityWithoutFallback() {
        Roster roster = TestRosters.demo();
        for (long seed = 1; seed <= 5; seed++) {
            GenerationResult result = generator.generate(TestRosters.threeShift(2), roster, 12, seed, START);

            assertThat(result.months()).hasSize(12)
                    .noneMatch(MonthDiagnostics::roundRobinFallback);
            ValidationReport report = validator.validate(result.schedule(), roster);
            assertThat(report.details()).extracting(Violation::rule).doesNotContain(RuleType.STABILITY);
        }
    }

    @Test
    void generate_listsShiftsInTemplateOrder() {
        Schedule schedule = generator.generate(TestRosters.threeShift(2), TestRosters.demo(), 1, 3L, START).schedule();

        assertThat(schedule.month("January 2025").keySet()).containsExactly("Morning", "Afternoon", "Night");
    }

    @Test
    void generate_neverMakesRankOneFloater() {
        Roster roster = TestRosters.demo();
        Schedule schedule = generator.generate(TestRosters.threeShift(2), roster, 12, 11L, START).schedule();

        for (String month : schedule.monthLabels()) {
            for (ShiftAssignment shift : schedule.month(month).values()) {
                for (EmployeeRef floater : shift.floaters()) {
                    assertThat(roster.rankOfName(floater.name())).get().isNotEqualTo(1);
                }
            }
        }
    }

    @Test
    void generate_fillsEveryShiftWithExactlyPeoplePerShift() {
        Schedule schedule = generator.generate(TestRosters.threeShift(2), TestRosters.demo(), 6, 5L, START).schedule();

        for (String month : schedule.monthLabels()) {
            assertThat(schedule.month(month).values())
                    .allSatisfy(shift -> assertThat(shift.assignedStaff()).hasSize(2));
        }
    }

    @Test
    void generate_placesEveryEmployeeOncePerMonth() {
        Roster roster = TestRosters.demo();
        Schedule schedule = generator.generate(TestRosters.threeShift(2), roster, 4, 9L, START).schedule();

        for (String month : schedule.monthLabels()) {
            List<String> names = new ArrayList<>();
            schedule.month(month).values().forEach(shift -> {
                shift.assignedStaff().forEach(ref -> names.add(ref.name()));
                shift.floaters().forEach(ref -> names.add(ref.name()));
            });
            assertThat(names).doesNotHaveDuplicates().hasSize(roster.size());
        }
    }

    @Test
    void generate_isReproducibleForSameSeed() {
        Schedule first = generator.generate(TestRosters.threeShift(2), TestRosters.demo(), 6, 42L, START).schedule();
        Schedule second = generator.generate(TestRosters.threeShift(2), TestRosters.demo(), 6, 42L, START).schedule();

        assertThat(first).isEqualTo(second);
    }

    @Test
    void generate_repeatsFloaterOnlyWhenBackfillWasNeeded() {
        GenerationResult result = generator.generate(TestRosters.threeShift(2), TestRosters.demo(), 6, 13L, START);
        List<String> months = result.schedule().monthLabels();

        for (int i = 1; i < months.size(); i++) {
            Set<String> previous = floaters(result.schedule(), months.get(i - 1));
            Set<String> current = floaters(result.schedule(), months.get(i));
            current.retainAll(previous);
            assertThat(result.months().get(i).backfilledFloaters()).containsAll(current);
        }
    }

    @Test
    void generate_noBackfillWhenCandidatePoolIsLargeEnough() {
        // 2 floater slots, 6 eligible candidates
        List<RosterEmployee> members = new ArrayList<>();
        for (int i = 1; i <= 8; i++) {
            members.add(employee(i, "E" + i, i <= 4 ? 1 : i <= 6 ? 2 : 3));
        }
        for (int i = 9; i <= 10; i++) {
            members.add(employee(i, "E" + i, 3));
        }
        TeamConfiguration config = new TeamConfiguration(1L, "Wide", "4-shift", 2);
        GenerationResult result = generator.generate(config, Roster.of(members), 6, 21L, START);

        assertThat(result.months()).noneMatch(MonthDiagnostics::fairnessBackfillUsed);
        ValidationReport report = validator.validate(result.schedule(), Roster.of(members));
        assertThat(report.details()).extracting(Violation::rule).doesNotContain(RuleType.FLOATER_FAIRNESS);
    }

    @Test
    void demoTeam_firstMonthHasNoExemptionCoverageOrDiversityViolations() {
        Roster roster = TestRosters.demo();
        GenerationResult result = generator.generate(TestRosters.threeShift(2), roster, 1, 17L, START);

        MonthDiagnostics diagnostics = result.months().get(0);
        assertThat(diagnostics.floatersRequired()).isEqualTo(6);
        assertThat(diagnostics.floaters()).hasSize(6);

        ValidationReport report = validator.validate(result.schedule(), roster);
        assertThat(report.details()).extracting(Violation::rule)
                .doesNotContain(RuleType.FLOATER_EXEMPTION, RuleType.COVERAGE, RuleType.DIVERSITY);
    }

    @Test
    void largeRoster_generatedScheduleKeepsCoverageAndExemption() {
        List<RosterEmployee> members = new ArrayList<>();
        for (int i = 1; i <= 18; i++) {
            members.add(employee(i, "Member " + i, i <= 4 ? 1 : i <= 10 ? 2 : 3));
        }
        Roster roster = Roster.of(members);
        Schedule schedule = generator.generate(TestRosters.threeShift(2), roster, 8, 99L, START).schedule();

        ValidationReport report = validator.validate(schedule, roster);
        assertThat(report.details()).extracting(Violation::rule)
                .doesNotContain(RuleType.FLOATER_EXEMPTION, RuleType.COVERAGE, RuleType.FORMAT);
    }

    @Test
    void singleRankTeam_isScheduledWithoutDiversityRequirement() {
        List<RosterEmployee> members = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            members.add(employee(i, "Peer " + i, 2));
        }
        GenerationResult result = generator.generate(TestRosters.threeShift(2), Roster.of(members), 3, 4L, START);

        assertThat(result.months()).noneMatch(MonthDiagnostics::roundRobinFallback);
        assertThat(floaters(result.schedule(), "January 2025")).isEmpty();
    }

    @Test
    void generate_rejectsEmptyRoster() {
        assertThatThrownBy(() -> generator.generate(TestRosters.threeShift(2), Roster.of(List.of()), 1, 1L, START))
                .isInstanceOf(ScheduleGenerationException.class)
                .extracting("errorCode").isEqualTo(ScheduleGenerationException.EMPTY_ROSTER);
    }

    @Test
    void generate_rejectsUnknownTemplate() {
        TeamConfiguration config = new TeamConfiguration(1L, "Odd", "7-shift", 2);

        assertThatThrownBy(() -> generator.generate(config, TestRosters.demo(), 1, 1L, START))
                .isInstanceOf(ScheduleGenerationException.class)
                .hasMessageContaining("invalid shift template")
                .extracting("errorCode").isEqualTo(ScheduleGenerationException.UNKNOWN_TEMPLATE);
    }

    @Test
    void generate_rejectsRosterSmallerThanFixedStaff() {
        Roster small = Roster.of(TestRosters.demo().employees().subList(0, 5));

        assertThatThrownBy(() -> generator.generate(TestRosters.threeShift(2), small, 1, 1L, START))
                .isInstanceOf(ScheduleGenerationException.class)
                .hasMessageContaining("A minimum of 6 employees")
                .extracting("errorCode").isEqualTo(ScheduleGenerationException.INSUFFICIENT_HEADCOUNT);
    }

    @Test
    void generate_rejectsNonPositiveMonths() {
        assertThatThrownBy(() -> generator.generate(TestRosters.threeShift(2), TestRosters.demo(), 0, 1L, START))
                .isInstanceOf(ScheduleGenerationException.class)
                .extracting("errorCode").isEqualTo(ScheduleGenerationException.INVALID_MONTHS);
    }

    @Test
    void monthlyState_floaterMonthBreaksTheRun() {
        EmployeeMonthlyState state = new EmployeeMonthlyState(3);
        state.markNotFloater();
        state.assign(ShiftName.MORNING);
        assertThat(state.consecutiveMonthsOnShift()).isEqualTo(1);

        state.markFloater();
        assertThat(state.currentShift()).isEqualTo(ShiftName.MORNING);
        assertThat(state.consecutiveMonthsOnShift()).isZero();
        assertThat(state.monthsSinceFloater()).isZero();
        assertThat(FixedStaffAssigner.violatesRotation(state, ShiftName.MORNING)).isFalse();

        state.markNotFloater();
        state.assign(ShiftName.MORNING);
        assertThat(state.consecutiveMonthsOnShift()).isEqualTo(1);
        assertThat(FixedStaffAssigner.violatesRotation(state, ShiftName.MORNING)).isTrue();
        assertThat(FixedStaffAssigner.violatesRotation(state, ShiftName.NIGHT)).isFalse();

        state.markNotFloater();
        state.assign(ShiftName.NIGHT);
        assertThat(state.currentShift()).isEqualTo(ShiftName.NIGHT);
        assertThat(state.consecutiveMonthsOnShift()).isEqualTo(1);
    }

    private static Set<String> floaters(Schedule schedule, String month) {
        Set<String> names = new HashSet<>();
        schedule.month(month).values().forEach(shift -> shift.floaters().forEach(ref -> names.add(ref.name())));
        return names;
    }
}
