package com.callstt.processing.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

final class ProviderErrors {

    private ProviderErrors() {
    }

    static String extractMessage(ObjectMapper objectMapper, ClientHttpResponse response) throws IOException {
        String body = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8).trim();
        return extractMessage(objectMapper, body);
    }

    static String extractMessage(ObjectMapper objectMapper, String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                return body;
            }
            JsonNode nested = root.path("error").path("message");
            if (nested.isTextual()) {
                return nested.asText();
            }
            JsonNode message = root.path("message");
            if (message.isTextual()) {
                return message.asText();
            }
            return "";
        } catch (IOException exception) {
            return body;
        }
    }
}
