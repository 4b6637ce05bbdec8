package com.callstt.processing.service;

public record TranscriptionResult(
        String transcriptPath,
        String language
) {
}
