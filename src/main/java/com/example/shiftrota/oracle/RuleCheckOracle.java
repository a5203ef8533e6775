package com.example.shiftrota.oracle;

import com.example.shiftrota.schedule.Schedule;

/**
 * Second opinion on a schedule from an external rule checker. Advisory only: callers surface
 * the answer as a note and never let it override the programmatic validation.
 */
public interface RuleCheckOracle {

    /**
     * Must not throw; failures come back as {@link OracleReport#unavailable(String)}.
     */
    OracleReport check(Schedule schedule, String rulesText);

    default boolean isEnabled() {
        return true;
    }
}
