package com.example.shiftrota.schedule.validation;

import java.util.Arrays;
import java.util.Optional;

/**
 * Rule identifiers as they prefix violation messages. Junior rotation is covered by
 * {@link #STABILITY} with a one-month limit.
 */
public enum RuleType {
    STABILITY("Rule 1 (Stability)", true),
    FLOATER_EXEMPTION("Rule 2 (Floater Exemption)", true),
    FLOATER_FAIRNESS("Rule 3 (Floater Fairness)", true),
    COVERAGE("Coverage Rule", false),
    DIVERSITY("Diversity Rule", false),
    FORMAT("Format Error", false);

    private final String label;
    private final boolean core;

    RuleType(String label, boolean core) {
        this.label = label;
        this.core = core;
    }

    public String label() {
        return label;
    }

    /**
     * Core rules are the ones the repairer is allowed to act on.
     */
    public boolean isCore() {
        return core;
    }

    public static Optional<RuleType> fromMessage(String message) {
        if (message == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(r -> message.startsWith(r.label))
                .findFirst();
    }

    public static boolean isCoreMessage(String message) {
        return fromMessage(message).map(RuleType::isCore).orElse(false);
    }
}
