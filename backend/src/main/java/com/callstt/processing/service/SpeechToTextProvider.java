package com.callstt.processing.service;

import com.callstt.processing.model.SttJob;

public interface SpeechToTextProvider {

    String engine();

    default boolean isAvailable() {
        return true;
    }

    TranscriptionResult transcribe(SttJob job);
}
