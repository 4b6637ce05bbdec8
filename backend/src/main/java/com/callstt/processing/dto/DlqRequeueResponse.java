package com.callstt.processing.dto;

import com.callstt.processing.model.DeadLetterEntry;
import com.callstt.processing.model.SttJob;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record DlqRequeueResponse(
        String status,
        @JsonProperty("entry_id") String entryId,
        SttJob job,
        String reason,
        @JsonProperty("failed_at") Instant failedAt,
        @JsonProperty("status_code") Integer statusCode
) {

    public static DlqRequeueResponse requeued(String entryId, DeadLetterEntry entry) {
        return new DlqRequeueResponse(
                "requeued",
                entryId,
                entry.job(),
                entry.reason(),
                entry.failedAt(),
                entry.statusCode()
        );
    }
}
