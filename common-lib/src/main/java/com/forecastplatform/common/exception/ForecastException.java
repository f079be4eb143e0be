package com.forecastplatform.common.exception;

/**
 * Base of all forecasting failures. Carries the id of the affected run when known.
 */
public class ForecastException extends RuntimeException {
    private final Long runId;

    public ForecastException(Long runId, String message) {
        super(format(runId, message));
        this.runId = runId;
    }

    public ForecastException(Long runId, String message, Throwable cause) {
        super(format(runId, message), cause);
        this.runId = runId;
    }

    public Long getRunId() {
        return runId;
    }

    private static String format(Long runId, String message) {
        return runId == null ? message : "[run " + runId + "] " + message;
    }
}
