package com.williamcallahan.booru_source_resolver.service.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.booru_source_resolver.service.fetch.FetchResponse;
import com.williamcallahan.booru_source_resolver.types.FetchException;

import java.io.IOException;

/**
 * JSON helpers shared by the platform clients.
 */
final class PlatformResponses {

    private PlatformResponses() {
    }

    static JsonNode readJson(ObjectMapper objectMapper, FetchResponse response, String url) {
        try {
            return objectMapper.readTree(response.getBody());
        } catch (IOException e) {
            throw new FetchException("Malformed JSON from " + url + ": " + e.getMessage(), url, response.getStatus(), e);
        }
    }

    static String requireText(JsonNode node, String field, String url) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isEmpty()) {
            throw new FetchException("Missing '" + field + "' in response from " + url, url, null);
        }
        return value.asText();
    }

    static int requireInt(JsonNode node, String field, String url) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt()) {
            throw new FetchException("Missing integer '" + field + "' in response from " + url, url, null);
        }
        return value.asInt();
    }
}
