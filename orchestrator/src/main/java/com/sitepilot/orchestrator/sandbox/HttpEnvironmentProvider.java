package com.sitepilot.orchestrator.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitepilot.orchestrator.config.OrchestratorProperties;
import com.sitepilot.orchestrator.sandbox.dto.CreateSandboxRequest;
import com.sitepilot.orchestrator.sandbox.dto.CreateSandboxResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * HTTP client for the sandbox executor service.
 *
 * Creation is a single POST; the executor answers 400 or 422 with a body
 * mentioning the timeout when the requested lifetime is out of range.
 */
@Component
public class HttpEnvironmentProvider implements EnvironmentProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpEnvironmentProvider.class);

    private final ExecutorHttp http;
    private final Duration     maxTimeout;
    private final String       template;

    @Autowired
    public HttpEnvironmentProvider(
            @Value("${sitepilot.executor.base-url}") String baseUrl,
            ObjectMapper objectMapper,
            OrchestratorProperties properties) {
        this(new ExecutorHttp(baseUrl, objectMapper),
             properties.getSandbox().getMaxTimeout(),
             properties.getSandbox().getTemplate());
    }

    HttpEnvironmentProvider(ExecutorHttp http, Duration maxTimeout, String template) {
        this.http       = http;
        this.maxTimeout = maxTimeout;
        this.template   = template;
    }

    @Override
    public EnvironmentHandle create(Duration timeout) {
        log.info("Creating sandbox (timeout={}s, template={})", timeout.toSeconds(), template);
        ExecutorHttp.Response resp = http.postRaw("/sandboxes",
                new CreateSandboxRequest(timeout.toSeconds(), template),
                "createSandbox", Duration.ofSeconds(120));
        if (!resp.ok()) {
            String body = resp.body() == null ? "" : resp.body();
            if ((resp.status() == 400 || resp.status() == 422)
                    && body.toLowerCase(Locale.ROOT).contains("timeout")) {
                throw new TimeoutRejectedException(timeout, body);
            }
            throw new SandboxException("createSandbox failed: HTTP " + resp.status() + ": " + body);
        }
        CreateSandboxResponse created = http.parse(resp.body(), CreateSandboxResponse.class, "createSandbox");
        if (created.sandbox_id() == null || created.sandbox_id().isBlank()) {
            throw new SandboxException("createSandbox returned no sandbox_id");
        }
        log.info("Sandbox '{}' created", created.sandbox_id());
        return new HttpEnvironmentHandle(created.sandbox_id(), http);
    }

    @Override
    public Duration maxTimeout() {
        return maxTimeout;
    }
}
