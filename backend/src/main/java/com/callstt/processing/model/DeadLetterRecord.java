package com.callstt.processing.model;

public record DeadLetterRecord(
        String entryId,
        DeadLetterEntry entry
) {
}
