package com.callstt.processing.service;

import com.callstt.config.AppProperties;
import com.callstt.processing.model.SttJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class ProviderRouter {

    private static final Logger log = LoggerFactory.getLogger(ProviderRouter.class);
    private static final String FALLBACK_ENGINE = "stub";

    private final Map<String, SpeechToTextProvider> providers = new LinkedHashMap<>();
    private final String defaultEngine;

    public ProviderRouter(List<SpeechToTextProvider> candidates, AppProperties appProperties) {
        for (SpeechToTextProvider provider : candidates) {
            if (!provider.isAvailable()) {
                log.info("Skipping STT provider {}: not enabled or not configured", provider.engine());
                continue;
            }
            providers.put(provider.engine(), provider);
        }
        String configured = appProperties.stt().defaultEngine();
        this.defaultEngine = configured == null || configured.isBlank() ? FALLBACK_ENGINE : configured;
        log.info("STT providers enabled: {} (default {})", providers.keySet(), defaultEngine);
    }

    public TranscriptionResult transcribe(SttJob job) {
        String engine = job.engine().isBlank() ? defaultEngine : job.engine();
        SpeechToTextProvider provider = providers.get(engine);
        if (provider == null) {
            throw new TranscriptionException(null, "STT engine '" + engine + "' is not enabled");
        }
        return provider.transcribe(job);
    }
}
