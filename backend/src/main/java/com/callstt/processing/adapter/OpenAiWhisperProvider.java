package com.callstt.processing.adapter;

import com.callstt.config.AppProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

@Component
public class OpenAiWhisperProvider extends AbstractHttpTranscriptionProvider {

    public static final String ENGINE = "openai-whisper";

    public OpenAiWhisperProvider(RestClient sttRestClient,
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
        AppProperties.OpenAi openai = appProperties.openai();
        return openai != null && openai.enabled() && openai.apiKey() != null && !openai.apiKey().isBlank();
    }

    @Override
    protected String endpoint() {
        String baseUrl = appProperties.openai().baseUrl();
        return baseUrl.replaceAll("/+$", "") + "/audio/transcriptions";
    }

    @Override
    protected String bearerToken() {
        return appProperties.openai().apiKey();
    }

    @Override
    protected void addFormFields(MultiValueMap<String, Object> body, String language) {
        body.add("model", appProperties.openai().model());
        // verbose_json is rejected by some transcription models; json works across variants.
        body.add("response_format", "json");
        super.addFormFields(body, language);
    }
}
