package com.sitepilot.orchestrator.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * JSON-over-HTTP plumbing shared by {@link HttpEnvironmentProvider} and
 * {@link HttpEnvironmentHandle}.
 *
 * Uses java.net.http.HttpClient so every header and byte on the wire is
 * explicit. Calls block; an interrupt while waiting is reported as a
 * {@link CancellationException} with the interrupt flag restored.
 */
class ExecutorHttp {

    /** Raw response for callers that need to inspect non-2xx bodies. */
    record Response(int status, String body) {
        boolean ok() { return status >= 200 && status < 300; }
    }

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    ExecutorHttp(String baseUrl, ObjectMapper json, HttpClient http) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.json    = json;
        this.http    = http;
    }

    ExecutorHttp(String baseUrl, ObjectMapper json) {
        this(baseUrl, json, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    /** POST a JSON body and return the body of a 2xx response. */
    String post(String path, Object body, String opName, Duration timeout) {
        Response resp = exchange(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body))), opName);
        return requireOk(resp, opName);
    }

    /** POST without status checking. */
    Response postRaw(String path, Object body, String opName, Duration timeout) {
        return exchange(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body))), opName);
    }

    String get(String path, String opName, Duration timeout) {
        Response resp = exchange(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET(), opName);
        return requireOk(resp, opName);
    }

    void delete(String path, String opName, Duration timeout) {
        Response resp = exchange(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json")
                .DELETE(), opName);
        requireOk(resp, opName);
    }

    <T> T parse(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new SandboxException("Failed to parse " + opName + " response", e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private Response exchange(HttpRequest.Builder builder, String opName) {
        try {
            HttpResponse<String> resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            return new Response(resp.statusCode(), resp.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException(opName + " interrupted");
        } catch (IOException e) {
            throw new SandboxException(opName + " failed", e);
        }
    }

    private static String requireOk(Response resp, String opName) {
        if (!resp.ok()) {
            throw new SandboxException(
                    opName + " failed: HTTP " + resp.status() + ": " + resp.body());
        }
        return resp.body();
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new SandboxException("JSON serialization failed", e);
        }
    }
}
