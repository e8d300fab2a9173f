package dev.mealplans.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Draft generator backed by a local Ollama server's {@code /api/generate} endpoint.
 */
public final class OllamaDraftGenerator implements DraftGenerator {

    private static final Logger log = LoggerFactory.getLogger(OllamaDraftGenerator.class);

    public static final String DEFAULT_BASE_URL = "http://localhost:11434";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int HTTP_ERROR_THRESHOLD = 400;

    private final HttpClient client;
    private final String baseUrl;
    private final Duration requestTimeout;

    public OllamaDraftGenerator(String baseUrl, Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), baseUrl, requestTimeout);
    }

    OllamaDraftGenerator(HttpClient client, String baseUrl, Duration requestTimeout) {
        this.client = client;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public DraftResponse requestDraft(String prompt, String model) {
        long start = System.currentTimeMillis();
        ObjectNode body = MAPPER.createObjectNode();
        body.put("model", model);
        body.put("prompt", prompt);
        body.put("stream", false);

        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/api/generate"))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body), StandardCharsets.UTF_8))
                .build();
            log.debug("POST {}/api/generate model={} promptLength={}", baseUrl, model, prompt.length());

            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            long elapsed = System.currentTimeMillis() - start;
            if (response.statusCode() >= HTTP_ERROR_THRESHOLD) {
                log.warn("Ollama returned HTTP {}: {}", response.statusCode(), response.body());
                return DraftResponse.failed("HTTP " + response.statusCode() + ": " + response.body(), elapsed);
            }

            JsonNode root = MAPPER.readTree(response.body());
            if (root.hasNonNull("error")) {
                return DraftResponse.failed(root.get("error").asText(), elapsed);
            }
            JsonNode text = root.get("response");
            if (text == null || text.isNull()) {
                return DraftResponse.failed("Response has no 'response' field", elapsed);
            }
            log.debug("Ollama responded in {} ms ({} chars)", elapsed, text.asText().length());
            return DraftResponse.ok(text.asText(), elapsed);
        } catch (IOException e) {
            log.warn("Ollama request failed: {}", e.getMessage());
            return DraftResponse.failed("Request failed: " + e.getMessage(), System.currentTimeMillis() - start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DraftResponse.failed("Request interrupted", System.currentTimeMillis() - start);
        }
    }

    @Override
    public String getName() {
        return "ollama";
    }
}
