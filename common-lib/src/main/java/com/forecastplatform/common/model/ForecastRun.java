package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * One forecast execution as tracked by the external store.
 *
 * <p>Lifecycle: created {@code pending} by the launcher, moved to {@code running}
 * when orchestration starts, then to {@code completed} or {@code failed}.
 * Every transition is expressed as a {@link ForecastRunUpdate} patch;
 * {@link #apply(ForecastRunUpdate)} gives the row as the store would hold it
 * after the patch.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ForecastRun(
    @JsonProperty("id")                  Long            id,
    @JsonProperty("name")                String          name,
    @JsonProperty("description")         String          description,
    @JsonProperty("targetYear")          int             targetYear,
    @JsonProperty("targetPosition")      String          targetPosition,
    @JsonProperty("targetState")         String          targetState,
    @JsonProperty("targetElectionType")  String          targetElectionType,
    @JsonProperty("status")              RunStatus       status,
    @JsonProperty("startedAt")           Instant         startedAt,
    @JsonProperty("completedAt")         Instant         completedAt,
    @JsonProperty("totalSimulations")    Integer         totalSimulations,
    @JsonProperty("historicalYearsUsed") List<Integer>   historicalYearsUsed,
    @JsonProperty("modelParameters")     ModelParameters modelParameters,
    @JsonProperty("narrative")           String          narrative,
    @JsonProperty("createdBy")           String          createdBy,
    @JsonProperty("createdAt")           Instant         createdAt
) {
    /** A new run awaiting execution. {@code id} is assigned by the store. */
    public static ForecastRun pending(String name, String description, int targetYear,
                                      String targetPosition, String targetState,
                                      String targetElectionType, List<Integer> historicalYears,
                                      ModelParameters parameters, String createdBy, Instant now) {
        return new ForecastRun(null, name, description, targetYear, targetPosition, targetState,
            targetElectionType, RunStatus.PENDING, null, null, null, historicalYears,
            parameters, null, createdBy, now);
    }

    public ForecastRun withId(long newId) {
        return new ForecastRun(newId, name, description, targetYear, targetPosition, targetState,
            targetElectionType, status, startedAt, completedAt, totalSimulations,
            historicalYearsUsed, modelParameters, narrative, createdBy, createdAt);
    }

    public ForecastRun apply(ForecastRunUpdate update) {
        return new ForecastRun(id, name, description, targetYear, targetPosition, targetState,
            targetElectionType,
            update.status()              != null ? update.status()              : status,
            update.startedAt()           != null ? update.startedAt()           : startedAt,
            update.completedAt()         != null ? update.completedAt()         : completedAt,
            update.totalSimulations()    != null ? update.totalSimulations()    : totalSimulations,
            update.historicalYearsUsed() != null ? update.historicalYearsUsed() : historicalYearsUsed,
            update.modelParameters()     != null ? update.modelParameters()     : modelParameters,
            update.narrative()           != null ? update.narrative()           : narrative,
            createdBy, createdAt);
    }
}
