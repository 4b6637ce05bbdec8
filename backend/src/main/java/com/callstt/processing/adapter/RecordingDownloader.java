package com.callstt.processing.adapter;

import com.callstt.processing.service.TranscriptionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Component
public class RecordingDownloader {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public RecordingDownloader(RestClient sttRestClient, ObjectMapper objectMapper) {
        this.restClient = sttRestClient;
        this.objectMapper = objectMapper;
    }

    public Path download(String recordingUrl, Path destinationDir) {
        URI uri;
        try {
            uri = URI.create(recordingUrl);
        } catch (IllegalArgumentException exception) {
            uri = null;
        }
        String scheme = uri == null || uri.getScheme() == null ? "" : uri.getScheme().toLowerCase();

        try {
            Files.createDirectories(destinationDir);
            if (scheme.isEmpty() || scheme.equals("file")) {
                Path source = scheme.isEmpty() ? Path.of(recordingUrl) : Path.of(uri);
                if (!Files.exists(source)) {
                    throw new TranscriptionException(null, "Recording not found at " + recordingUrl);
                }
                Path target = destinationDir.resolve(fileName(source.getFileName()));
                Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
                return target;
            }

            if (scheme.equals("http") || scheme.equals("https")) {
                byte[] body = restClient.get()
                        .uri(uri)
                        .retrieve()
                        .onStatus(status -> !status.is2xxSuccessful(), (request, response) -> {
                            String message = ProviderErrors.extractMessage(objectMapper, response);
                            throw new TranscriptionException(
                                    response.getStatusCode().value(),
                                    message.isBlank() ? "Unable to download recording" : message
                            );
                        })
                        .body(byte[].class);
                Path target = destinationDir.resolve(fileName(Path.of(uri.getPath()).getFileName()));
                Files.write(target, body == null ? new byte[0] : body);
                return target;
            }
        } catch (IOException exception) {
            throw new TranscriptionException(null, "Unable to store recording " + recordingUrl, exception);
        } catch (RestClientException exception) {
            throw new TranscriptionException(null, "Recording download failed: " + exception.getMessage(), exception);
        }

        throw new TranscriptionException(null, "Unsupported recording URL scheme: " + scheme);
    }

    private static String fileName(Path name) {
        return name == null || name.toString().isBlank() ? "recording" : name.toString();
    }
}
