package com.callstt.calls.model;

public enum CallStatus {
    PENDING,
    DOWNLOADING,
    DOWNLOADED,
    TRANSCRIBING,
    COMPLETED,
    SKIPPED,
    ERROR,
    MISSING_AUDIO
}
