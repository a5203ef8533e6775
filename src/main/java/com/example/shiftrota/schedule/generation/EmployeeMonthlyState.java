package com.example.shiftrota.schedule.generation;

import com.example.shiftrota.roster.ShiftName;

/**
 * Per-employee history carried from one simulated month to the next. Lives for one generation run.
 */
final class EmployeeMonthlyState {

    static final int NEVER_FLOATED = 999;

    private final int rank;
    private int monthsSinceFloater = NEVER_FLOATED;
    private ShiftName currentShift;
    private int consecutiveMonthsOnShift;
    private boolean floaterLastMonth;

    EmployeeMonthlyState(int rank) {
        this.rank = rank;
    }

    int rank() {
        return rank;
    }

    int monthsSinceFloater() {
        return monthsSinceFloater;
    }

    ShiftName currentShift() {
        return currentShift;
    }

    int consecutiveMonthsOnShift() {
        return consecutiveMonthsOnShift;
    }

    boolean wasFloaterLastMonth() {
        return floaterLastMonth;
    }

    void markFloater() {
        monthsSinceFloater = 0;
        floaterLastMonth = true;
        // a floater month interrupts any run on a fixed shift
        consecutiveMonthsOnShift = 0;
    }

    void markNotFloater() {
        monthsSinceFloater++;
        floaterLastMonth = false;
    }

    void assign(ShiftName shift) {
        if (shift == currentShift) {
            consecutiveMonthsOnShift++;
        } else {
            currentShift = shift;
            consecutiveMonthsOnShift = 1;
        }
    }
}
