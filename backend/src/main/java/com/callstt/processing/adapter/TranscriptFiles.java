package com.callstt.processing.adapter;

import com.callstt.config.AppProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class TranscriptFiles {

    private final Path root;

    public TranscriptFiles(AppProperties appProperties) {
        this.root = Path.of(appProperties.stt().transcriptsDir());
    }

    public Path pathFor(String callId) {
        try {
            Files.createDirectories(root);
        } catch (IOException exception) {
            throw new IllegalStateException("Failed to initialize transcripts directory", exception);
        }
        return root.resolve(sanitise(callId) + ".txt");
    }

    public Path write(String callId, String text) {
        Path target = pathFor(callId);
        try {
            Files.writeString(target, text.strip() + "\n", StandardCharsets.UTF_8);
            return target;
        } catch (IOException exception) {
            throw new IllegalStateException("Unable to write transcript for call " + callId, exception);
        }
    }

    static String sanitise(String callId) {
        StringBuilder builder = new StringBuilder(callId.length());
        for (char ch : callId.toCharArray()) {
            builder.append(Character.isLetterOrDigit(ch) || ch == '-' || ch == '_' ? ch : '_');
        }
        String stem = builder.toString().replaceAll("^[._]+|[._]+$", "");
        return stem.isEmpty() ? "transcript" : stem;
    }
}
