package com.forecastplatform.common.scenario;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Manual shift, in percentage points, applied to a party's latest share. */
public record PartyAdjustment(
    @JsonProperty("voteShareAdjust") double voteShareAdjust,
    @JsonProperty("reason")          String reason
) {}
