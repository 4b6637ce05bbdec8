package com.callstt.processing.adapter;

import com.callstt.config.AppProperties;
import com.callstt.processing.model.SttJob;
import com.callstt.processing.service.SpeechToTextProvider;
import com.callstt.processing.service.TranscriptionException;
import com.callstt.processing.service.TranscriptionResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;
import java.util.stream.Stream;

public abstract class AbstractHttpTranscriptionProvider implements SpeechToTextProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpTranscriptionProvider.class);

    protected final RestClient restClient;
    protected final ObjectMapper objectMapper;
    protected final AppProperties appProperties;
    private final RecordingDownloader recordingDownloader;
    private final TranscriptFiles transcriptFiles;

    protected AbstractHttpTranscriptionProvider(RestClient restClient,
                                                ObjectMapper objectMapper,
                                                AppProperties appProperties,
                                                RecordingDownloader recordingDownloader,
                                                TranscriptFiles transcriptFiles) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
        this.recordingDownloader = recordingDownloader;
        this.transcriptFiles = transcriptFiles;
    }

    protected abstract String endpoint();

    protected abstract String bearerToken();

    protected void addFormFields(MultiValueMap<String, Object> body, String language) {
        if (language != null && !language.isBlank()) {
            body.add("language", language);
        }
    }

    @Override
    public TranscriptionResult transcribe(SttJob job) {
        String language = job.language();
        if (language == null || language.isBlank()) {
            String fallback = appProperties.stt().defaultLanguage();
            language = fallback == null || fallback.isBlank() ? null : fallback;
        }

        Path tempDir = createTempDir();
        try {
            Path recording = recordingDownloader.download(job.recordingUrl(), tempDir);
            ensureLimits(recording);

            MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
            addFormFields(body, language);
            body.add("file", new FileSystemResource(recording));

            String rawResponse;
            try {
                rawResponse = restClient.post()
                        .uri(endpoint())
                        .contentType(MediaType.MULTIPART_FORM_DATA)
                        .headers(headers -> {
                            String token = bearerToken();
                            if (token != null && !token.isBlank()) {
                                headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + token);
                            }
                        })
                        .body(body)
                        .retrieve()
                        .onStatus(status -> !status.is2xxSuccessful(), (request, response) -> {
                            int statusCode = response.getStatusCode().value();
                            String message = withLimitHint(statusCode, ProviderErrors.extractMessage(objectMapper, response));
                            throw new TranscriptionException(
                                    statusCode,
                                    message.isBlank() ? "STT provider error" : message
                            );
                        })
                        .body(String.class);
            } catch (RestClientException exception) {
                throw new TranscriptionException(null, engine() + " request failed: " + exception.getMessage(), exception);
            }

            return readResult(job, rawResponse, language);
        } finally {
            deleteQuietly(tempDir);
        }
    }

    private TranscriptionResult readResult(SttJob job, String rawResponse, String language) {
        JsonNode root;
        try {
            root = objectMapper.readTree(rawResponse == null ? "" : rawResponse);
        } catch (IOException exception) {
            throw new TranscriptionException(null, "Unexpected response from " + engine(), exception);
        }

        JsonNode text = root == null ? null : root.get("text");
        if (text == null || !text.isTextual()) {
            throw new TranscriptionException(null, engine() + " response is missing transcript text");
        }

        JsonNode detected = root.get("language");
        Path transcript = transcriptFiles.write(job.callId(), text.asText());
        return new TranscriptionResult(
                transcript.toString(),
                detected != null && detected.isTextual() ? detected.asText() : language
        );
    }

    private void ensureLimits(Path recording) {
        int maxMinutes = appProperties.stt().maxFileMinutes();
        if (maxMinutes > 0) {
            OptionalDouble seconds = durationSeconds(recording);
            if (seconds.isPresent() && seconds.getAsDouble() > maxMinutes * 60.0) {
                String message = String.format("Recording duration exceeds configured limit: %.1f min > %d min",
                        seconds.getAsDouble() / 60.0, maxMinutes);
                throw tooLarge(message);
            }
        }

        int maxMb = appProperties.stt().maxFileSizeMb();
        if (maxMb <= 0) {
            return;
        }
        long size;
        try {
            size = Files.size(recording);
        } catch (IOException exception) {
            throw new TranscriptionException(null, "Unable to read recording size", exception);
        }
        if (size > maxMb * 1024L * 1024L) {
            throw tooLarge(String.format("Recording size %.1f MB exceeds %d MB limit", size / (1024.0 * 1024.0), maxMb));
        }
    }

    private TranscriptionException tooLarge(String message) {
        int status = HttpStatus.PAYLOAD_TOO_LARGE.value();
        return new TranscriptionException(status, withLimitHint(status, message));
    }

    // Only formats the JDK sound API can read (WAV, AIFF, AU) report a duration.
    private OptionalDouble durationSeconds(Path recording) {
        try {
            AudioFileFormat fileFormat = AudioSystem.getAudioFileFormat(recording.toFile());
            long frames = fileFormat.getFrameLength();
            float frameRate = fileFormat.getFormat().getFrameRate();
            if (frames == AudioSystem.NOT_SPECIFIED || frameRate <= 0) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(frames / (double) frameRate);
        } catch (UnsupportedAudioFileException | IOException exception) {
            log.debug("Duration of {} is unknown, skipping duration limit", recording.getFileName(), exception);
            return OptionalDouble.empty();
        }
    }

    String withLimitHint(int statusCode, String message) {
        String hint = null;
        if (statusCode == HttpStatus.PAYLOAD_TOO_LARGE.value()) {
            hint = appProperties.stt().errorHint413();
            if (hint != null && appProperties.stt().maxFileSizeMb() > 0) {
                hint = hint + " (max " + appProperties.stt().maxFileSizeMb() + " MB)";
            }
        } else if (statusCode == HttpStatus.UNPROCESSABLE_ENTITY.value()) {
            hint = appProperties.stt().errorHint422();
        }

        if (hint == null || hint.isBlank()) {
            return message;
        }
        return message == null || message.isBlank() ? hint : message + ". " + hint;
    }

    private Path createTempDir() {
        try {
            return Files.createTempDirectory("stt-" + engine() + "-");
        } catch (IOException exception) {
            throw new TranscriptionException(null, "Unable to create working directory", exception);
        }
    }

    private void deleteQuietly(Path dir) {
        List<Path> paths = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(paths::add);
        } catch (IOException exception) {
            log.warn("Unable to list temporary STT directory {}", dir, exception);
            return;
        }
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException exception) {
                log.warn("Unable to delete temporary STT file {}", path, exception);
            }
        }
    }
}
