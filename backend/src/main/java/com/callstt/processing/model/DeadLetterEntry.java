package com.callstt.processing.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

@JsonPropertyOrder({"job", "reason", "failed_at", "status_code"})
public record DeadLetterEntry(
        @JsonProperty("job") SttJob job,
        @JsonProperty("reason") String reason,
        @JsonProperty("status_code") Integer statusCode,
        @JsonProperty("failed_at") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant failedAt
) {

    public DeadLetterEntry {
        if (job == null) {
            throw new IllegalArgumentException("DLQ entry requires a job");
        }
        if (failedAt == null) {
            failedAt = Instant.now();
        }
    }

    public static DeadLetterEntry of(SttJob job, String reason, Integer statusCode) {
        return new DeadLetterEntry(job, reason, statusCode, Instant.now());
    }
}
