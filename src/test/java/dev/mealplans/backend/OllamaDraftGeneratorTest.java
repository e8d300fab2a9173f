package dev.mealplans.backend;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class OllamaDraftGeneratorTest {

    private HttpServer server;
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String responseBody = "{\"model\": \"llama3\", \"response\": \"{\\\"days\\\": []}\", \"done\": true}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/generate", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private OllamaDraftGenerator generator() {
        return new OllamaDraftGenerator("http://127.0.0.1:" + server.getAddress().getPort() + "/",
            Duration.ofSeconds(5));
    }

    @Test
    void returnsResponseText() {
        DraftResponse response = generator().requestDraft("plan please", "llama3");

        assertThat(response.success()).isTrue();
        assertThat(response.responseText()).isEqualTo("{\"days\": []}");
        assertThat(requestBody.get())
            .contains("\"model\":\"llama3\"")
            .contains("\"prompt\":\"plan please\"")
            .contains("\"stream\":false");
    }

    @Test
    void reportsHttpErrors() {
        status = 500;
        responseBody = "model not loaded";

        DraftResponse response = generator().requestDraft("plan please", "llama3");

        assertThat(response.success()).isFalse();
        assertThat(response.error()).isEqualTo("HTTP 500: model not loaded");
    }

    @Test
    void reportsErrorField() {
        responseBody = "{\"error\": \"model 'foo' not found\"}";

        DraftResponse response = generator().requestDraft("plan please", "foo");

        assertThat(response.success()).isFalse();
        assertThat(response.error()).isEqualTo("model 'foo' not found");
    }

    @Test
    void reportsUnreachableServer() {
        server.stop(0);

        DraftResponse response = generator().requestDraft("plan please", "llama3");

        assertThat(response.success()).isFalse();
        assertThat(response.error()).startsWith("Request failed");
    }
}
