package com.example.shiftrota.exception;

/**
 * State conflict on a team's stored schedule, e.g. generating while one already exists.
 */
public class BusinessException extends RuntimeException {

    public static final String SCHEDULE_EXISTS = "SCHEDULE_EXISTS";
    public static final String SCHEDULE_NOT_FOUND = "SCHEDULE_NOT_FOUND";
    public static final String SCHEDULE_UNREADABLE = "SCHEDULE_UNREADABLE";

    private final String errorCode;
    private final Object[] parameters;

    public BusinessException(String message) {
        super(message);
        this.errorCode = "BUSINESS_ERROR";
        this.parameters = new Object[0];
    }

    public BusinessException(String errorCode, String message, Object... parameters) {
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
