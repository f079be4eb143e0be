package com.forecastplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A party's votes in one year together with the share (0–100) those votes
 * represent of the year's total across all parties.
 */
public record VoteShare(
    @JsonProperty("year")  int    year,
    @JsonProperty("votes") long   votes,
    @JsonProperty("share") double share
) {
    public VoteShare withShare(double newShare) {
        return new VoteShare(year, votes, newShare);
    }
}
