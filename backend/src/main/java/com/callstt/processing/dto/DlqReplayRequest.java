package com.callstt.processing.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record DlqReplayRequest(
        @JsonProperty("record_id") @NotNull(message = "record_id is required") Long recordId,
        @NotBlank(message = "reason is required") String reason
) {
}
