package com.example.oncall.exception;

/**
 * Fatal configuration problem detected before or while building a schedule.
 * Per-week infeasibility is never reported through this exception.
 */
public class ScheduleGenerationException extends RuntimeException {

    public static final String EMPTY_ROSTER = "EMPTY_ROSTER";
    public static final String ROSTER_NOT_FOUND = "ROSTER_NOT_FOUND";
    public static final String INVALID_WEEK_COUNT = "INVALID_WEEK_COUNT";
    public static final String INVALID_START_DATE = "INVALID_START_DATE";
    public static final String CSV_EXPORT_FAILED = "CSV_EXPORT_FAILED";

    private final String errorCode;
    private final Object[] parameters;

    public ScheduleGenerationException(String errorCode, String message, Object... parameters) {
        super(message);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    public ScheduleGenerationException(String errorCode, String message, Throwable cause, Object... parameters) {
        super(message, cause);
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
