package com.callstt.config;

import com.callstt.processing.service.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class ProcessingConfig {

    @Bean
    Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    @Bean
    RestClient sttRestClient(RestClient.Builder builder, AppProperties appProperties) {
        Duration timeout = appProperties.stt().requestTimeout() == null
                ? Duration.ofSeconds(30)
                : appProperties.stt().requestTimeout();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        return builder.requestFactory(requestFactory).build();
    }
}
