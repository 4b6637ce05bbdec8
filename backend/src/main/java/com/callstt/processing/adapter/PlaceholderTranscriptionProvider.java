package com.callstt.processing.adapter;

import com.callstt.processing.model.SttJob;
import com.callstt.processing.service.SpeechToTextProvider;
import com.callstt.processing.service.TranscriptionResult;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class PlaceholderTranscriptionProvider implements SpeechToTextProvider {

    public static final String ENGINE = "stub";
    static final String PLACEHOLDER_TEXT =
            "Transcription placeholder. Configure a real STT provider to replace this output.\n";

    private final TranscriptFiles transcriptFiles;

    public PlaceholderTranscriptionProvider(TranscriptFiles transcriptFiles) {
        this.transcriptFiles = transcriptFiles;
    }

    @Override
    public String engine() {
        return ENGINE;
    }

    @Override
    public TranscriptionResult transcribe(SttJob job) {
        Path target = transcriptFiles.pathFor(job.callId());
        if (!Files.exists(target)) {
            try {
                Files.writeString(target, PLACEHOLDER_TEXT, StandardCharsets.UTF_8);
            } catch (IOException exception) {
                throw new IllegalStateException("Unable to write placeholder transcript", exception);
            }
        }
        return new TranscriptionResult(target.toString(), job.language());
    }
}
