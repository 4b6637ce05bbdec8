package com.callstt.processing.dto;

import com.callstt.processing.model.DeadLetterRecord;
import com.callstt.processing.model.SttJob;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record DlqEntryResponse(
        @JsonProperty("entry_id") String entryId,
        SttJob job,
        String reason,
        @JsonProperty("failed_at") Instant failedAt,
        @JsonProperty("status_code") Integer statusCode
) {

    public static DlqEntryResponse from(DeadLetterRecord record) {
        return new DlqEntryResponse(
                record.entryId(),
                record.entry().job(),
                record.entry().reason(),
                record.entry().failedAt(),
                record.entry().statusCode()
        );
    }
}
