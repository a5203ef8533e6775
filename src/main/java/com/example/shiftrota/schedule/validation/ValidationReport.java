package com.example.shiftrota.schedule.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ValidationReport(
        @JsonProperty("is_valid") boolean valid,
        @JsonIgnore List<Violation> details,
        @JsonProperty("validation_notes") String validationNotes) {

    public ValidationReport {
        details = details == null ? List.of() : List.copyOf(details);
        validationNotes = validationNotes == null ? "" : validationNotes;
    }

    static ValidationReport of(List<Violation> violations, String notes) {
        return new ValidationReport(violations.isEmpty(), violations, notes);
    }

    @JsonProperty("violations")
    public List<String> violations() {
        return details.stream().map(Violation::message).toList();
    }

    @JsonIgnore
    public List<Violation> coreViolations() {
        return details.stream().filter(Violation::isCore).toList();
    }

    @JsonIgnore
    public int coreCount() {
        return (int) details.stream().filter(Violation::isCore).count();
    }

    @JsonIgnore
    public int nonCoreCount() {
        return details.size() - coreCount();
    }

    public ValidationReport withNote(String note) {
        if (note == null || note.isBlank()) {
            return this;
        }
        String joined = validationNotes.isBlank() ? note : validationNotes + " " + note;
        return new ValidationReport(valid, details, joined);
    }
}
