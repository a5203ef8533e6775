package com.example.shiftrota.schedule.repair;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One edit applied by the repairer. Swaps also name the paired employee and where they went.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleChange(
        @JsonProperty("type") Kind kind,
        @JsonProperty("employee") String employee,
        @JsonProperty("month") String month,
        @JsonProperty("shift_from") String shiftFrom,
        @JsonProperty("shift_to") String shiftTo,
        @JsonProperty("role_from") String roleFrom,
        @JsonProperty("role_to") String roleTo,
        @JsonProperty("paired_employee") String pairedEmployee,
        @JsonProperty("paired_shift_from") String pairedShiftFrom,
        @JsonProperty("paired_shift_to") String pairedShiftTo) {

    public enum Kind {
        /** single assigned employee moved to another shift */
        MOVE,
        /** two assigned employees exchange shifts */
        SWAP,
        /** a floater and an assigned employee exchange places */
        ROLE_SWAP
    }

    static final String ASSIGNED = "assigned";
    static final String FLOATER = "floater";

    static ScheduleChange move(String employee, String month, String from, String to) {
        return new ScheduleChange(Kind.MOVE, employee, month, from, to, ASSIGNED, ASSIGNED, null, null, null);
    }

    static ScheduleChange swap(String employee, String month, String from, String to, String paired) {
        return new ScheduleChange(Kind.SWAP, employee, month, from, to, ASSIGNED, ASSIGNED, paired, to, from);
    }

    static ScheduleChange roleSwap(String floater, String month, String floaterShift,
                                   String assignee, String assigneeShift) {
        return new ScheduleChange(Kind.ROLE_SWAP, floater, month, floaterShift, assigneeShift, FLOATER, ASSIGNED,
                assignee, assigneeShift, floaterShift);
    }
}
