package com.gdin.inspection.graphalgo.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlgorithmStatistics {

    @JsonProperty("name")
    String name;

    @JsonProperty("last_run_time")
    Instant lastRunTime;

    @JsonProperty("last_run_duration")
    Double lastRunDuration;

    @JsonProperty("last_result_count")
    Integer lastResultCount;

    @JsonProperty("timeout")
    Integer timeout;
}
