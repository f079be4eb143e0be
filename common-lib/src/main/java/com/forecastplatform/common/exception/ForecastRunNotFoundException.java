package com.forecastplatform.common.exception;

public class ForecastRunNotFoundException extends ForecastException {

    public ForecastRunNotFoundException(long runId) {
        super(runId, "Forecast run not found");
    }
}
