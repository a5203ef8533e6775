package com.example.shiftrota.schedule.generation;

import java.util.List;

/**
 * What the generator had to do for one month.
 *
 * @param backfilledFloaters floaters picked although they floated the month before, because the
 *                           pool of fresh candidates was too small
 * @param overflow           true when fixed staff exceeded shift capacity because not enough
 *                           floater-eligible employees existed
 */
public record MonthDiagnostics(
        String month,
        int floatersRequired,
        List<String> floaters,
        List<String> backfilledFloaters,
        int attempts,
        boolean roundRobinFallback,
        boolean overflow) {

    public MonthDiagnostics {
        floaters = List.copyOf(floaters);
        backfilledFloaters = List.copyOf(backfilledFloaters);
    }

    public boolean fairnessBackfillUsed() {
        return !backfilledFloaters.isEmpty();
    }
}
