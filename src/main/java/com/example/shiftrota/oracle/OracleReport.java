package com.example.shiftrota.oracle;

import java.util.List;

public record OracleReport(boolean available, boolean valid, List<String> violations, String note) {

    public OracleReport {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static OracleReport unavailable(String reason) {
        return new OracleReport(false, false, List.of(), "Rule-check oracle unavailable: " + reason);
    }

    /**
     * One-line summary suitable for appending to validation notes.
     */
    public String summary() {
        if (!available) {
            return note;
        }
        if (valid) {
            return "Rule-check oracle found no violations.";
        }
        return "Rule-check oracle reported " + violations.size() + " issue(s): " + String.join("; ", violations);
    }
}
