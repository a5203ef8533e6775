package com.example.shiftrota.exception;

/**
 * A schedule document does not have the month / shift / role / employee shape.
 */
public class ScheduleFormatException extends Exception {

    public ScheduleFormatException(String message) {
        super(message);
    }

    public ScheduleFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
