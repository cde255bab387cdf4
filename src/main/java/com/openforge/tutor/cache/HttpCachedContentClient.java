package com.openforge.tutor.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * REST client for the Gemini {@code cachedContents} resource.
 *
 *   create → POST   {base}/cachedContents
 *   renew  → PATCH  {base}/{handle}?updateMask=ttl
 *   delete → DELETE {base}/{handle}
 *
 * Authenticated with the x-goog-api-key header.
 */
@Slf4j
@Component
public class HttpCachedContentClient implements CachedContentClient {

    private final HttpClient      httpClient;
    private final ObjectMapper    objectMapper;
    private final CacheProperties properties;

    public HttpCachedContentClient(HttpClient httpClient, ObjectMapper objectMapper, CacheProperties properties) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.properties   = properties;
    }

    @Override
    public String create(String model, String displayName, String systemInstruction, Duration ttl) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model.startsWith("models/") ? model : "models/" + model);
        body.put("displayName", displayName);
        body.putObject("systemInstruction")
                .putArray("parts")
                .addObject()
                .put("text", systemInstruction);
        body.put("ttl", ttl.toSeconds() + "s");

        JsonNode response = send(request("/cachedContents")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString())), "create");

        String name = response.path("name").asText(null);
        if (name == null || name.isBlank()) {
            throw new CacheClientException("Cache create for %s returned no name".formatted(model));
        }
        return name;
    }

    @Override
    public void renew(String handle, Duration ttl) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("ttl", ttl.toSeconds() + "s");
        send(request("/" + handle + "?updateMask=ttl")
                .method("PATCH", HttpRequest.BodyPublishers.ofString(body.toString())), "renew");
    }

    @Override
    public void delete(String handle) {
        send(request("/" + handle).DELETE(), "delete");
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(properties.baseUrl() + path))
                .header("Content-Type", "application/json")
                .header("x-goog-api-key", properties.apiKey() == null ? "" : properties.apiKey())
                .timeout(Duration.ofSeconds(properties.timeoutSeconds()));
    }

    private JsonNode send(HttpRequest.Builder builder, String operation) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheClientException("Interrupted during cache " + operation, e);
        } catch (IOException e) {
            throw new CacheClientException("Network error during cache " + operation, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new CacheClientException("Cache %s returned HTTP %d: %s"
                    .formatted(operation, status, response.body()));
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new CacheClientException("Unreadable cache " + operation + " response", e);
        }
    }
}
