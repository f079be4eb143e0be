package com.forecastplatform.common.exception;

import java.util.List;

/** No historical data matched the requested scope, so nothing can be forecast. */
public class DataInsufficiencyException extends ForecastException {

    public DataInsufficiencyException(long runId, List<Integer> years) {
        super(runId, "No historical data available for years " + years);
    }
}
