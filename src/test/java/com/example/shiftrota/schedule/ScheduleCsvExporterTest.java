package com.example.shiftrota.schedule;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleCsvExporterTest {

    private final ScheduleCsvExporter exporter = new ScheduleCsvExporter();

    @Test
    void export_writesOneRowPerPersonAndRole() {
        Map<String, ShiftAssignment> shifts = new LinkedHashMap<>();
        shifts.put("Morning", new ShiftAssignment(
                List.of(new EmployeeRef("Ana", "Engineer"), new EmployeeRef("Ben", "Team Lead")),
                List.of(new EmployeeRef("Cora", "Engineer"))));
        shifts.put("Night", new ShiftAssignment(List.of(new EmployeeRef("Dan", "Senior, Ops")), List.of()));
        Schedule schedule = Schedule.builder().month("June 2025", shifts).build();

        ScheduleCsvExporter.CsvFile file = exporter.export("Demo Team", schedule);

        String csv = new String(file.data(), StandardCharsets.UTF_8);
        assertThat(csv).startsWith("\uFEFF");
        String[] lines = csv.substring(1).split("\n");
        assertThat(lines).containsExactly(
                "team,month,shift,employee,designation,role",
                "Demo Team,June 2025,Morning,Ana,Engineer,assigned",
                "Demo Team,June 2025,Morning,Ben,Team Lead,assigned",
                "Demo Team,June 2025,Morning,Cora,Engineer,floater",
                "Demo Team,June 2025,Night,Dan,\"Senior, Ops\",assigned");
        assertThat(file.filename()).isEqualTo("schedule-demo-team.csv");
    }

    @Test
    void export_ofEmptySchedule_hasHeaderOnly() {
        ScheduleCsvExporter.CsvFile file = exporter.export("Ops", Schedule.empty());

        assertThat(new String(file.data(), StandardCharsets.UTF_8))
                .isEqualTo("\uFEFFteam,month,shift,employee,designation,role\n");
    }

    @Test
    void filename_slugsTeamName() {
        assertThat(ScheduleCsvExporter.filename("  Night Ops / EU ")).isEqualTo("schedule-night-ops-eu.csv");
        assertThat(ScheduleCsvExporter.filename("***")).isEqualTo("schedule.csv");
    }
}
