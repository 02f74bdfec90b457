package com.orderstream.syncclient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.EnvelopeSerializer;
import com.orderstream.syncmodel.Identifiable;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Bootstraps a cache from the ordering service's REST collection endpoint
 * ({@code GET {baseUrl}/api/v1/{resourcePath}}). A singleton resource such as settings answers
 * with one object, which is returned as a one-element list.
 */
public class RestBootstrapSource<T extends Identifiable> implements BootstrapSource<T> {

    private final RestTemplate restTemplate;
    private final String url;
    private final Class<T> payloadType;
    private final ObjectMapper mapper = EnvelopeSerializer.objectMapper();

    public RestBootstrapSource(RestTemplate restTemplate, String baseUrl, EntityType entityType, Class<T> payloadType) {
        if (!entityType.payloadType().equals(payloadType)) {
            throw new IllegalArgumentException(entityType.value() + " does not carry " + payloadType.getSimpleName());
        }
        this.restTemplate = restTemplate;
        this.url = stripTrailingSlash(baseUrl) + "/api/v1/" + entityType.resourcePath();
        this.payloadType = payloadType;
    }

    @Override
    public List<T> fetchAll() {
        String body;
        try {
            body = restTemplate.getForObject(url, String.class);
        } catch (RestClientException e) {
            throw new BootstrapException("GET " + url + " failed", e);
        }
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            if (body.strip().startsWith("{")) {
                return List.of(mapper.readValue(body, payloadType));
            }
            return mapper.readValue(body, mapper.getTypeFactory().constructCollectionType(List.class, payloadType));
        } catch (JsonProcessingException e) {
            throw new BootstrapException("Unreadable response from " + url, e);
        }
    }

    public String url() {
        return url;
    }

    private static String stripTrailingSlash(String baseUrl) {
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
}
