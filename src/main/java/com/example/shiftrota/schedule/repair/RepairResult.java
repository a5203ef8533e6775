package com.example.shiftrota.schedule.repair;

import com.example.shiftrota.schedule.Schedule;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RepairResult(
        @JsonProperty("schedule") Schedule schedule,
        @JsonProperty("changes_made") List<ScheduleChange> changesMade,
        @JsonProperty("violations_fixed") List<String> violationsFixed,
        @JsonProperty("violations_remaining") List<String> violationsRemaining,
        @JsonProperty("message") String message,
        @JsonProperty("success") boolean success) {

    public RepairResult {
        changesMade = List.copyOf(changesMade);
        violationsFixed = List.copyOf(violationsFixed);
        violationsRemaining = List.copyOf(violationsRemaining);
    }

    static RepairResult unchanged(Schedule schedule, List<String> remaining, String message) {
        return new RepairResult(schedule, List.of(), List.of(), remaining, message, true);
    }

    @JsonIgnore
    public boolean changed() {
        return !changesMade.isEmpty();
    }
}
