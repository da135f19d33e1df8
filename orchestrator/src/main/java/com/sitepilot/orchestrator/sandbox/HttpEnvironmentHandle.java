package com.sitepilot.orchestrator.sandbox;

import com.sitepilot.orchestrator.sandbox.dto.FileReadRequest;
import com.sitepilot.orchestrator.sandbox.dto.FileReadResponse;
import com.sitepilot.orchestrator.sandbox.dto.FileWriteRequest;
import com.sitepilot.orchestrator.sandbox.dto.HostResponse;
import com.sitepilot.orchestrator.sandbox.dto.RunCommandRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link EnvironmentHandle} backed by the sandbox executor's REST API.
 */
public class HttpEnvironmentHandle implements EnvironmentHandle {

    private static final Logger log = LoggerFactory.getLogger(HttpEnvironmentHandle.class);

    private static final Duration FILE_TIMEOUT = Duration.ofSeconds(60);

    // Extra wall-clock time on top of the command's own limit so the executor
    // can report the timeout instead of the HTTP call giving up first.
    private static final Duration COMMAND_GRACE = Duration.ofSeconds(30);

    private final String       sandboxId;
    private final ExecutorHttp http;

    HttpEnvironmentHandle(String sandboxId, ExecutorHttp http) {
        this.sandboxId = sandboxId;
        this.http      = http;
    }

    @Override
    public String id() {
        return sandboxId;
    }

    @Override
    public String readFile(String path) {
        String body = http.post(base() + "/files/read", new FileReadRequest(path),
                "readFile " + path + " in " + sandboxId, FILE_TIMEOUT);
        FileReadResponse resp = http.parse(body, FileReadResponse.class, "readFile");
        if (resp.content() == null) {
            throw new SandboxException("File not found: " + path);
        }
        return resp.content();
    }

    @Override
    public void writeFile(String path, String content) {
        http.post(base() + "/files/write", new FileWriteRequest(path, content),
                "writeFile " + path + " in " + sandboxId, FILE_TIMEOUT);
    }

    @Override
    public CommandResult run(String command, Duration timeout) {
        log.debug("Sandbox {} run ({}s): {}", sandboxId, timeout.toSeconds(), command);
        String body = http.post(base() + "/commands/run",
                new RunCommandRequest(command, Math.max(1, timeout.toSeconds())),
                "run command in " + sandboxId, timeout.plus(COMMAND_GRACE));
        return http.parse(body, CommandResult.class, "run");
    }

    @Override
    public String resolvePublicUrl(int port) {
        String body = http.get(base() + "/host?port=" + URLEncoder.encode(String.valueOf(port), StandardCharsets.UTF_8),
                "resolveHost " + port + " in " + sandboxId, FILE_TIMEOUT);
        return "https://" + http.parse(body, HostResponse.class, "resolveHost").host();
    }

    @Override
    public void terminate() {
        log.info("Terminating sandbox '{}'", sandboxId);
        http.delete(base(), "terminate " + sandboxId, Duration.ofSeconds(30));
    }

    private String base() {
        return "/sandboxes/" + sandboxId;
    }
}
