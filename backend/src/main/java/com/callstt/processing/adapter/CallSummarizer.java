package com.callstt.processing.adapter;

import com.callstt.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

@Component
public class CallSummarizer {

    private static final Logger log = LoggerFactory.getLogger(CallSummarizer.class);
    private static final int MIN_BULLETS = 3;
    private static final int MAX_BULLETS = 5;
    private static final int MAX_BULLET_LENGTH = 256;
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final boolean enabled;
    private final Path root;

    public CallSummarizer(AppProperties appProperties) {
        AppProperties.Summary summary = appProperties.stt().summary();
        this.enabled = summary != null && summary.enabled();
        this.root = summary == null || summary.dir() == null ? null : Path.of(summary.dir());
    }

    public Optional<Path> summarize(String callId, String transcriptPath) {
        if (!enabled || root == null || transcriptPath == null) {
            return Optional.empty();
        }

        try {
            String transcript = Files.readString(Path.of(transcriptPath), StandardCharsets.UTF_8);
            if (transcript.isBlank()) {
                return Optional.empty();
            }

            StringBuilder markdown = new StringBuilder();
            for (String bullet : bullets(transcript)) {
                markdown.append("- ").append(bullet).append('\n');
            }
            Files.createDirectories(root);
            Path target = root.resolve(TranscriptFiles.sanitise(callId) + ".md");
            Files.writeString(target, markdown.toString(), StandardCharsets.UTF_8);
            return Optional.of(target);
        } catch (IOException | IllegalArgumentException exception) {
            log.error("Failed to generate call summary callId={}", callId, exception);
            return Optional.empty();
        }
    }

    static List<String> bullets(String transcript) {
        String text = transcript.strip();
        List<String> bullets = new ArrayList<>();
        for (String line : text.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            for (String sentence : SENTENCE_BOUNDARY.split(line.strip())) {
                String cleaned = WHITESPACE.matcher(sentence.strip()).replaceAll(" ");
                if (cleaned.isEmpty()) {
                    continue;
                }
                bullets.add(truncate(cleaned));
                if (bullets.size() >= MAX_BULLETS) {
                    return bullets;
                }
            }
        }

        if (bullets.size() >= MIN_BULLETS) {
            return bullets;
        }

        for (String chunk : chunks(text)) {
            bullets.add(truncate(chunk));
        }
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(bullets));
        if (unique.size() < MIN_BULLETS) {
            throw new IllegalArgumentException("Unable to generate enough summary bullets from transcript");
        }
        return unique.subList(0, Math.min(MAX_BULLETS, unique.size()));
    }

    private static List<String> chunks(String text) {
        String[] words = WHITESPACE.split(text);
        int chunkSize = Math.max(1, (int) Math.ceil(words.length / (double) MIN_BULLETS));
        List<String> chunks = new ArrayList<>();
        for (int index = 0; index < MIN_BULLETS; index++) {
            int start = index * chunkSize;
            int end = index < MIN_BULLETS - 1 ? Math.min(start + chunkSize, words.length) : words.length;
            if (start >= end) {
                continue;
            }
            chunks.add(String.join(" ", Arrays.asList(words).subList(start, end)));
        }
        return chunks;
    }

    private static String truncate(String text) {
        if (text.length() <= MAX_BULLET_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_BULLET_LENGTH - 1).stripTrailing() + "…";
    }
}
