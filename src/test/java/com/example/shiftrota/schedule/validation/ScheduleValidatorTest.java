package com.example.shiftrota.schedule.validation;

import com.example.shiftrota.TestRosters;
import com.example.shiftrota.roster.Roster;
import com.example.shiftrota.schedule.Schedule;
import com.example.shiftrota.schedule.ShiftAssignment;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.shiftrota.TestRosters.assigned;
import static com.example.shiftrota.TestRosters.employee;
import static com.example.shiftrota.TestRosters.shift;
import static org.assertj.core.api.Assertions.assertThat;

class ScheduleValidatorTest {

    private final ScheduleValidator validator = new ScheduleValidator();

    // Lead rank 1, Senior rank 2, Cora and Dan rank 3
    private final Roster roster = TestRosters.roster(
            employee(1, "Lead", 1),
            employee(2, "Senior", 2),
            employee(3, "Cora", 3),
            employee(4, "Dan", 3));

    @Test
    void juniorOnSameShiftTwoMonths_reportsOneStabilityViolation() {
        Schedule schedule = Schedule.builder()
                .month("January 2025", shifts(assigned("Cora", "Lead"), assigned("Senior", "Dan")))
                .month("February 2025", shifts(assigned("Cora", "Dan"), assigned("Lead", "Senior")))
                .build();

        ValidationReport report = validator.validate(schedule, roster);

        List<Violation> stability = ofRule(report, RuleType.STABILITY);
        assertThat(stability).hasSize(1);
        Violation violation = stability.get(0);
        assertThat(violation.employee()).isEqualTo("Cora");
        assertThat(violation.shift()).isEqualTo("Morning");
        assertThat(violation.months()).containsExactly("January 2025", "February 2025");
        assertThat(violation.measured()).isEqualTo(2);
        assertThat(violation.limit()).isEqualTo(1);
        assertThat(violation.message()).startsWith("Rule 1 (Stability): Cora (rank 3) stayed on Morning for 2");
        assertThat(report.valid()).isFalse();
    }

    @Test
    void rankOne_mayStayThreeMonthsButNotFour() {
        Schedule.Builder builder = Schedule.builder();
        String[] months = {"January 2025", "February 2025", "March 2025", "April 2025"};
        for (int i = 0; i < months.length; i++) {
            boolean even = i % 2 == 0;
            builder.month(months[i], shifts(
                    assigned("Lead", even ? "Cora" : "Dan"),
                    assigned("Senior", even ? "Dan" : "Cora")));
        }

        List<Violation> stability = ofRule(validator.validate(builder.build(), roster), RuleType.STABILITY);

        // Senior (limit 2) and Lead (limit 3) both overstay on four straight months
        assertThat(stability).extracting(Violation::employee).containsExactlyInAnyOrder("Lead", "Senior");
        Violation lead = stability.stream().filter(v -> v.employee().equals("Lead")).findFirst().orElseThrow();
        assertThat(lead.measured()).isEqualTo(4);
        assertThat(lead.limit()).isEqualTo(3);

        Schedule threeMonths = Schedule.builder()
                .month(months[0], shifts(assigned("Lead", "Cora"), assigned("Senior", "Dan")))
                .month(months[1], shifts(assigned("Lead", "Dan"), assigned("Cora", "Senior")))
                .month(months[2], shifts(assigned("Lead", "Cora"), assigned("Dan", "Senior")))
                .build();
        assertThat(ofRule(validator.validate(threeMonths, roster), RuleType.STABILITY))
                .extracting(Violation::employee).doesNotContain("Lead");
    }

    @Test
    void floaterMonth_interruptsStabilityRun() {
        Schedule schedule = Schedule.builder()
                .month("January 2025", shifts(assigned("Cora", "Lead"), shift(List.of("Senior", "Dan"), List.of())))
                .month("February 2025", shifts(shift(List.of("Lead", "Dan"), List.of("Cora")), assigned("Senior")))
                .month("March 2025", shifts(assigned("Cora", "Senior"), assigned("Lead", "Dan")))
                .build();

        assertThat(ofRule(validator.validate(schedule, roster), RuleType.STABILITY))
                .extracting(Violation::employee).doesNotContain("Cora");
    }

    @Test
    void rankOneFloater_isReported() {
        Schedule schedule = Schedule.builder()
                .month("January 2025", shifts(
                        shift(List.of("Cora"), List.of("Lead")),
                        shift(List.of("Senior"), List.of("Dan"))))
                .build();

        List<Violation> exemption = ofRule(validator.validate(schedule, roster), RuleType.FLOATER_EXEMPTION);

        assertThat(exemption).hasSize(1);
        assertThat(exemption.get(0).message())
                .isEqualTo("Rule 2 (Floater Exemption): Lead (rank 1) is a floater on Morning in January 2025; "
                        + "rank 1 is exempt from floater duty");
    }

    @Test
    void floaterInAdjacentMonths_isReportedOncePerEmployee() {
        Schedule.Builder builder = Schedule.builder();
        for (String month : List.of("January 2025", "February 2025", "March 2025")) {
            builder.month(month, shifts(shift(List.of("Lead"), List.of("Dan")), assigned("Senior")));
        }
        List<Violation> fairness = ofRule(validator.validate(builder.build(), roster), RuleType.FLOATER_FAIRNESS);

        assertThat(fairness).hasSize(1);
        assertThat(fairness.get(0).employee()).isEqualTo("Dan");
        assertThat(fairness.get(0).months()).containsExactly("January 2025", "February 2025");
    }

    @Test
    void unequalAssignedStaff_isCoverageViolation() {
        Schedule schedule = Schedule.builder()
                .month("January 2025", shifts(assigned("Lead", "Cora"), assigned("Senior")))
                .build();

        ValidationReport report = validator.validate(schedule, roster);

        List<Violation> coverage = ofRule(report, RuleType.COVERAGE);
        assertThat(coverage).hasSize(1);
        assertThat(coverage.get(0).shift()).isEqualTo("Afternoon");
        assertThat(coverage.get(0).measured()).isEqualTo(1);
        assertThat(coverage.get(0).limit()).isEqualTo(2);
        assertThat(report.coreCount()).isZero();
    }

    @Test
    void singleRankShift_isDiversityViolation() {
        Schedule schedule = Schedule.builder()
                .month("January 2025", shifts(assigned("Cora", "Dan"), assigned("Lead", "Senior")))
                .build();

        List<Violation> diversity = ofRule(validator.validate(schedule, roster), RuleType.DIVERSITY);

        assertThat(diversity).hasSize(1);
        assertThat(diversity.get(0).message()).isEqualTo("Diversity Rule: all 2 assigned staff on Morning in January 2025 are rank 3");
    }

    @Test
    void validSchedule_hasNoViolations() {
        Schedule schedule = Schedule.builder()
                .month("January 2025", shifts(assigned("Lead", "Cora"), assigned("Senior", "Dan")))
                .month("February 2025", shifts(assigned("Lead", "Dan"), assigned("Senior", "Cora")))
                .build();

        ValidationReport report = validator.validate(schedule, roster);

        assertThat(report.valid()).isTrue();
        assertThat(report.violations()).isEmpty();
        assertThat(report.validationNotes()).contains("Checked 2 month(s) and 4 employee(s).");
    }

    @Test
    void rosterWithSharedName_isNoted() {
        Roster withTwoCoras = TestRosters.roster(
                employee(1, "Lead", 1),
                employee(2, "Senior", 2),
                employee(3, "Cora", 3),
                employee(5, "Cora", 2));
        Schedule schedule = Schedule.builder()
                .month("January 2025", shifts(assigned("Lead", "Cora"), assigned("Senior")))
                .build();

        ValidationReport report = validator.validate(schedule, withTwoCoras);

        assertThat(report.validationNotes()).contains("more than one member named Cora");
        assertThat(validator.validate(schedule, roster).validationNotes()).doesNotContain("more than one member");
    }

    @Test
    void unknownEmployee_isNotedAndSkipped() {
        Schedule schedule = Schedule.builder()
                .month("January 2025", shifts(assigned("Lead", "Ghost"), assigned("Senior", "Dan")))
                .month("February 2025", shifts(assigned("Senior", "Ghost"), assigned("Lead", "Dan")))
                .build();

        ValidationReport report = validator.validate(schedule, roster);

        assertThat(report.details()).extracting(Violation::employee).doesNotContain("Ghost");
        assertThat(report.validationNotes()).contains("Ghost");
    }

    @Test
    void malformedJson_isSingleFormatError() {
        ValidationReport report = validator.validate("{not json", roster);

        assertThat(report.valid()).isFalse();
        assertThat(report.violations()).hasSize(1);
        assertThat(report.violations().get(0)).startsWith("Format Error:");
    }

    @Test
    void wrongShape_isSingleFormatError() {
        ValidationReport report = validator.validate("{\"January 2025\": [1, 2]}", roster);

        assertThat(report.details()).extracting(Violation::rule).containsExactly(RuleType.FORMAT);
    }

    @Test
    void emptyScheduleOrRoster_isFormatError() {
        assertThat(validator.validate(Schedule.empty(), roster).details())
                .extracting(Violation::rule).containsExactly(RuleType.FORMAT);

        Schedule schedule = Schedule.builder()
                .month("January 2025", shifts(assigned("Lead"), assigned("Dan")))
                .build();
        assertThat(validator.validate(schedule, Roster.of(List.of())).details())
                .extracting(Violation::rule).containsExactly(RuleType.FORMAT);
    }

    @Test
    void nonConsecutiveMonths_areNoted() {
        Schedule schedule = Schedule.builder()
                .month("January 2025", shifts(assigned("Lead", "Cora"), assigned("Senior", "Dan")))
                .month("March 2025", shifts(assigned("Lead", "Dan"), assigned("Senior", "Cora")))
                .build();

        assertThat(validator.validate(schedule, roster).validationNotes()).contains("not consecutive");
    }

    @Test
    void ruleType_classifiesMessagesByPrefix() {
        assertThat(RuleType.isCoreMessage("Rule 3 (Floater Fairness): X")).isTrue();
        assertThat(RuleType.isCoreMessage("Coverage Rule: X")).isFalse();
        assertThat(RuleType.fromMessage("Format Error: bad")).contains(RuleType.FORMAT);
        assertThat(RuleType.fromMessage("something else")).isEmpty();
    }

    private static Map<String, ShiftAssignment> shifts(ShiftAssignment morning, ShiftAssignment afternoon) {
        Map<String, ShiftAssignment> shifts = new LinkedHashMap<>();
        shifts.put("Morning", morning);
        shifts.put("Afternoon", afternoon);
        return shifts;
    }

    private static List<Violation> ofRule(ValidationReport report, RuleType rule) {
        return report.details().stream().filter(v -> v.rule() == rule).toList();
    }
}
