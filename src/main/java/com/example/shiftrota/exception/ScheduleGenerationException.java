package com.example.shiftrota.exception;

/**
 * Configuration error raised before any schedule is produced. Callers must not persist anything.
 */
public class ScheduleGenerationException extends RuntimeException {

    public static final String EMPTY_ROSTER = "EMPTY_ROSTER";
    public static final String UNKNOWN_TEMPLATE = "UNKNOWN_TEMPLATE";
    public static final String INSUFFICIENT_HEADCOUNT = "INSUFFICIENT_HEADCOUNT";
    public static final String INVALID_MONTHS = "INVALID_MONTHS";
    public static final String INVALID_PEOPLE_PER_SHIFT = "INVALID_PEOPLE_PER_SHIFT";

    private final String errorCode;
    private final Object[] parameters;

    public ScheduleGenerationException(String message) {
        super(message);
        this.errorCode = "SCHEDULE_GENERATION_ERROR";
        this.parameters = new Object[0];
    }

    public ScheduleGenerationException(String errorCode, String message, Object... parameters) {
        super(message);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object[] getParameters() {
        return parameters;
    }
}
