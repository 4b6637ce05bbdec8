package com.callstt.processing.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"record_id", "call_id", "recording_url", "engine", "language"})
public record SttJob(
        @JsonProperty("record_id") long recordId,
        @JsonProperty("call_id") String callId,
        @JsonProperty("recording_url") String recordingUrl,
        @JsonProperty("engine") String engine,
        @JsonProperty("language") String language
) {

    public SttJob {
        if (callId == null || recordingUrl == null || engine == null) {
            throw new IllegalArgumentException("STT job requires call_id, recording_url and engine");
        }
    }

    @JsonIgnore
    public String dedupKey() {
        return callId + "|" + recordingUrl + "|" + engine;
    }
}
