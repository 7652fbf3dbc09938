package com.pipewright.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pipewright.core.model.WorkerStatus;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the agentapi worker protocol.
 *
 * <p>{@code GET /status} answers {@code {"status": "running" | "stable"}};
 * {@code POST /message} accepts {@code {"content": ..., "type": "user"}}.
 */
public class AgentApiClient {

    private final String host;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public AgentApiClient(String host, Duration requestTimeout) {
        this.host = host;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    public URI baseUri(int port) {
        return URI.create("http://" + host + ":" + port);
    }

    public WorkerStatus status(int port) throws WorkerException {
        var request = HttpRequest.newBuilder(baseUri(port).resolve("/status"))
                .timeout(requestTimeout)
                .GET()
                .build();
        HttpResponse<String> response = send(request, "status");
        if (response.statusCode() != 200) {
            throw new WorkerException("Status request failed (HTTP " + response.statusCode() + "): "
                    + response.body());
        }

        JsonNode body;
        try {
            body = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new WorkerException("Failed to decode status response: " + e.getMessage(), e);
        }
        String status = body.path("status").asText("");
        return switch (status) {
            case "running" -> WorkerStatus.BUSY;
            case "stable" -> WorkerStatus.IDLE;
            default -> throw new WorkerException("Unknown worker status: '" + status + "'");
        };
    }

    public void sendMessage(int port, String content) throws WorkerException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("content", content);
        body.put("type", "user");

        var request = HttpRequest.newBuilder(baseUri(port).resolve("/message"))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
        HttpResponse<String> response = send(request, "message");
        if (response.statusCode() != 200 && response.statusCode() != 202) {
            throw new WorkerException("Message request failed (HTTP " + response.statusCode() + "): "
                    + response.body());
        }
    }

    private HttpResponse<String> send(HttpRequest request, String what) throws WorkerException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new WorkerException("Failed to send " + what + " request to " + request.uri()
                    + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerException("Interrupted during " + what + " request", e);
        }
    }
}
