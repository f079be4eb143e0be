package com.forecastplatform.common.exception;

/**
 * The text generator could not produce a narrative. Always recovered with a
 * fallback sentence; never fails a run.
 */
public class NarrativeGenerationException extends ForecastException {

    public NarrativeGenerationException(String message) {
        super(null, message);
    }

    public NarrativeGenerationException(String message, Throwable cause) {
        super(null, message, cause);
    }
}
