package com.callstt.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
        Stt stt,
        OpenAi openai,
        LocalStt localStt,
        Admin admin
) {

    public record Stt(
            String queueKey,
            String dlqKey,
            String processedKey,
            String defaultEngine,
            String defaultLanguage,
            int maxRetries,
            Duration baseBackoff,
            Duration idleSleep,
            Duration fetchTimeout,
            String transcriptsDir,
            int maxFileSizeMb,
            int maxFileMinutes,
            Duration requestTimeout,
            String errorHint413,
            String errorHint422,
            Worker worker,
            Summary summary
    ) {}

    public record Worker(
            boolean enabled
    ) {}

    public record Summary(
            boolean enabled,
            String dir
    ) {}

    public record OpenAi(
            boolean enabled,
            String apiKey,
            String baseUrl,
            String model
    ) {}

    public record LocalStt(
            boolean enabled,
            String url,
            String apiKey
    ) {}

    public record Admin(
            String apiKey
    ) {}
}
