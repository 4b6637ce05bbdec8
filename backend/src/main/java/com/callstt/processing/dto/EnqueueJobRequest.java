package com.callstt.processing.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

public record EnqueueJobRequest(
        @JsonProperty("record_id") @NotNull(message = "record_id is required") Long recordId,
        String engine,
        String language
) {
}
