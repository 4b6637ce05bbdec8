package com.callstt.processing.adapter;

import com.callstt.config.AppProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class LocalHttpTranscriptionProvider extends AbstractHttpTranscriptionProvider {

    public static final String ENGINE = "local";

    public LocalHttpTranscriptionProvider(RestClient sttRestClient,
                                          ObjectMapper objectMapper,
                                          AppProperties appProperties,
                                          RecordingDownloader recordingDownloader,
                                          TranscriptFiles transcriptFiles) {
        super(sttRestClient, objectMapper, appProperties, recordingDownloader, transcriptFiles);
    }

    @Override
    public String engine() {
        return ENGINE;
    }

    @Override
    public boolean isAvailable() {
        AppProperties.LocalStt local = appProperties.localStt();
        return local != null && local.enabled() && local.url() != null && !local.url().isBlank();
    }

    @Override
    protected String endpoint() {
        return appProperties.localStt().url();
    }

    @Override
    protected String bearerToken() {
        return appProperties.localStt().apiKey();
    }
}
