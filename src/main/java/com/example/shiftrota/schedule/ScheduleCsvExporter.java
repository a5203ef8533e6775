package com.example.shiftrota.schedule;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * One row per person per shift per month. Months and shifts keep the schedule's order.
 */
@Component
public class ScheduleCsvExporter {

    private static final String[] HEADERS = {"team", "month", "shift", "employee", "designation", "role"};

    public CsvFile export(String teamName, Schedule schedule) {
        StringBuilder builder = new StringBuilder();
        builder.append('\uFEFF');
        builder.append(String.join(",", HEADERS)).append('\n');

        for (String month : schedule.monthLabels()) {
            for (Map.Entry<String, ShiftAssignment> shift : schedule.month(month).entrySet()) {
                for (EmployeeRef ref : shift.getValue().assignedStaff()) {
                    appendRow(builder, teamName, month, shift.getKey(), ref, "assigned");
                }
                for (EmployeeRef ref : shift.getValue().floaters()) {
                    appendRow(builder, teamName, month, shift.getKey(), ref, "floater");
                }
            }
        }

        byte[] data = builder.toString().getBytes(StandardCharsets.UTF_8);
        return new CsvFile(filename(teamName), data);
    }

    private void appendRow(StringBuilder builder, String team, String month, String shift,
                           EmployeeRef ref, String role) {
        StringJoiner joiner = new StringJoiner(",");
        joiner.add(escapeCsv(team));
        joiner.add(escapeCsv(month));
        joiner.add(escapeCsv(shift));
        joiner.add(escapeCsv(ref.name()));
        joiner.add(escapeCsv(ref.designation()));
        joiner.add(role);
        builder.append(joiner).append('\n');
    }

    static String filename(String teamName) {
        String slug = teamName == null ? "" : teamName.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        slug = slug.replaceAll("(^-+)|(-+$)", "");
        return slug.isEmpty() ? "schedule.csv" : "schedule-" + slug + ".csv";
    }

    private String escapeCsv(String value) {
        String target = value == null ? "" : value;
        if (target.contains(",") || target.contains("\"") || target.contains("\n")) {
            return "\"" + target.replace("\"", "\"\"") + "\"";
        }
        return target;
    }

    public record CsvFile(String filename, byte[] data) { }
}
