package com.example.shiftrota.schedule.generation;

import com.example.shiftrota.schedule.Schedule;

import java.util.List;

public record GenerationResult(Schedule schedule, long seed, List<MonthDiagnostics> months) {

    public GenerationResult {
        months = List.copyOf(months);
    }
}
