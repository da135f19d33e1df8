package com.sitepilot.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitepilot.orchestrator.apply.CodeApplicationStateMachine;
import com.sitepilot.orchestrator.apply.FailureKind;
import com.sitepilot.orchestrator.apply.ProjectStructureValidator;
import com.sitepilot.orchestrator.config.OrchestratorProperties;
import com.sitepilot.orchestrator.config.TestProperties;
import com.sitepilot.orchestrator.correction.CorrectionLoopController;
import com.sitepilot.orchestrator.correction.CorrectionPlanner;
import com.sitepilot.orchestrator.generation.CodeGenerationClient;
import com.sitepilot.orchestrator.generation.GenerationException;
import com.sitepilot.orchestrator.generation.GenerationPayloadParser;
import com.sitepilot.orchestrator.generation.GenerationPrompts;
import com.sitepilot.orchestrator.lifecycle.DependencyAllowList;
import com.sitepilot.orchestrator.lifecycle.EnvironmentLifecycleManager;
import com.sitepilot.orchestrator.lifecycle.ProjectSnapshotter;
import com.sitepilot.orchestrator.sandbox.FakeEnvironmentHandle;
import com.sitepilot.orchestrator.sandbox.FakeEnvironmentProvider;
import com.sitepilot.orchestrator.session.SessionEnvironment;
import com.sitepilot.orchestrator.session.SessionLocks;
import com.sitepilot.orchestrator.session.SessionRegistry;
import com.sitepilot.orchestrator.validation.BuildLogParser;
import com.sitepilot.orchestrator.validation.ErrorKind;
import com.sitepilot.orchestrator.validation.StructuralValidator;
import com.sitepilot.orchestrator.validation.ValidationEngine;
import com.sitepilot.orchestrator.validation.ValidationError;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * The whole loop with real components, an in-memory sandbox and a scripted
 * generator.
 */
class GenerationOrchestratorTest {

    static final String GOOD_APP = """
            import React from 'react';
            export default function App() {
              return <h1 className="text-4xl">Sunrise Bakery</h1>;
            }
            """;

    // Missing the closing brace of App().
    static final String BROKEN_APP = """
            import React from 'react';
            export default function App() {
              return <h1>Sunrise Bakery</h1>;
            """;

    static final String EDITED_APP = """
            import React from 'react';
            export default function App() {
              return <h1 className="text-4xl text-amber-700">Sunrise Bakery</h1>;
            }
            """;

    /** Replies from a queue; a queued RuntimeException is thrown instead. */
    static class ScriptedGenerator implements CodeGenerationClient {
        record Call(String systemPrompt, String prompt) {}

        final Deque<Object> replies = new ArrayDeque<>();
        final List<Call>    calls   = new ArrayList<>();

        ScriptedGenerator reply(Object... next) {
            replies.addAll(List.of(next));
            return this;
        }

        @Override
        public String generate(String systemPrompt, String prompt) {
            calls.add(new Call(systemPrompt, prompt));
            Object next = replies.poll();
            if (next == null) {
                throw new IllegalStateException("No scripted reply for call " + calls.size());
            }
            if (next instanceof RuntimeException e) {
                throw e;
            }
            return (String) next;
        }
    }

    final ObjectMapper json = new ObjectMapper();

    OrchestratorProperties      props;
    FakeEnvironmentProvider     provider;
    EnvironmentLifecycleManager lifecycle;
    SessionLocks                locks;
    SessionRegistry             registry;
    ScriptedGenerator           generator;
    GenerationPrompts           prompts;
    SimpleMeterRegistry         meters;
    GenerationOrchestrator      orchestrator;

    @BeforeEach
    void setUp() {
        props     = TestProperties.fast();
        DependencyAllowList allowList = new DependencyAllowList(props);
        provider  = new FakeEnvironmentProvider();
        lifecycle = new EnvironmentLifecycleManager(provider, props, allowList);
        locks     = new SessionLocks();
        registry  = new SessionRegistry(lifecycle);
        generator = new ScriptedGenerator();
        prompts   = new GenerationPrompts(allowList);
        meters    = new SimpleMeterRegistry();
        orchestrator = orchestratorWith(generator);
    }

    private GenerationOrchestrator orchestratorWith(CodeGenerationClient client) {
        ProjectSnapshotter snapshotter = new ProjectSnapshotter(props);
        return new GenerationOrchestrator(
                locks,
                registry,
                client,
                new GenerationPayloadParser(json),
                prompts,
                new CodeApplicationStateMachine(lifecycle, new ProjectStructureValidator(), registry, props),
                new ValidationEngine(new StructuralValidator(), new BuildLogParser(), snapshotter),
                new CorrectionPlanner(),
                new CorrectionLoopController(props),
                snapshotter,
                meters);
    }

    private String files(String section, String path, String content) {
        try {
            return json.writeValueAsString(Map.of(section, List.of(Map.of("path", path, "content", content))));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    private List<String> systemPrompts() {
        return generator.calls.stream().map(ScriptedGenerator.Call::systemPrompt).toList();
    }

    // ------------------------------------------------------------------
    // Generate
    // ------------------------------------------------------------------

    @Test
    void handle_validFirstReply_succeedsAndRecordsBaseline() {
        generator.reply(files("files", "src/App.jsx", GOOD_APP));

        GenerationOutcome outcome = orchestrator.handle(GenerationRequest.generate("s1", "A bakery landing page"));

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(outcome.url()).isEqualTo("https://5173-sbx-1.sandbox.test");
        assertThat(outcome.files()).containsEntry("src/App.jsx", GOOD_APP).containsKey("package.json");
        SessionEnvironment env = registry.find("s1").orElseThrow();
        assertThat(env.hasBaseline()).isTrue();
        assertThat(generator.calls.get(0).prompt()).contains("A bakery landing page");
        assertThat(meters.counter("sitepilot.generation.outcomes", "status", "success").count()).isEqualTo(1.0);
    }

    @Test
    void handle_brokenThenFixed_targetedCorrectionWithCurrentFile() {
        generator.reply(files("files", "src/App.jsx", BROKEN_APP),
                        files("files_to_correct", "src/App.jsx", GOOD_APP));

        GenerationOutcome outcome = orchestrator.handle(GenerationRequest.generate("s1", "A bakery landing page"));

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(systemPrompts()).containsExactly(prompts.generateSystem(), prompts.correctionSystem());
        String correctionPrompt = generator.calls.get(1).prompt();
        assertThat(correctionPrompt).contains("UNBALANCED_BRACES", "src/App.jsx", "Sunrise Bakery");
        FakeEnvironmentHandle handle = provider.created().get(0);
        assertThat(handle.files()).containsEntry("my-app/src/App.jsx", GOOD_APP);
    }

    @Test
    void handle_neverConverges_regeneratesThenTerminates() {
        String broken = files("files", "src/App.jsx", BROKEN_APP);
        generator.reply(broken, broken, broken, broken, broken);

        GenerationOutcome outcome = orchestrator.handle(GenerationRequest.generate("s1", "A bakery landing page"));

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.VALIDATION_FAILED);
        assertThat(outcome.sandboxFailed()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(5);
        assertThat(outcome.url()).isEqualTo("https://5173-sbx-1.sandbox.test");
        assertThat(outcome.errors()).extracting(ValidationError::kind).contains(ErrorKind.UNBALANCED_BRACES);
        assertThat(systemPrompts()).containsExactly(
                prompts.generateSystem(), prompts.correctionSystem(), prompts.correctionSystem(),
                prompts.generateSystem(), prompts.correctionSystem());
        assertThat(generator.calls.get(3).prompt()).contains("A previous attempt failed");
        assertThat(registry.find("s1").orElseThrow().hasBaseline()).isFalse();
    }

    @Test
    void handle_unparseableReply_countsAsFailedAttempt() {
        generator.reply("I'd be happy to help! Here's a plan...", files("files", "src/App.jsx", GOOD_APP));

        GenerationOutcome outcome = orchestrator.handle(GenerationRequest.generate("s1", "A bakery landing page"));

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(2);
        assertThat(generator.calls.get(1).prompt()).contains("UNPARSEABLE_RESPONSE");
    }

    @Test
    void handle_generatorFails_infrastructureFailureWithoutSandboxFlag() {
        generator.reply(new GenerationException(401, "invalid x-api-key"));

        GenerationOutcome outcome = orchestrator.handle(GenerationRequest.generate("s1", "A bakery landing page"));

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.INFRASTRUCTURE_ERROR);
        assertThat(outcome.sandboxFailed()).isFalse();
        assertThat(outcome.error()).contains("invalid x-api-key");
    }

    @Test
    void handle_concurrentRequestsForOneSession_runOneAtATimeWhileOtherSessionsProceed() throws Exception {
        CountDownLatch firstEntered = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        List<String>   seen         = new CopyOnWriteArrayList<>();
        String         reply        = files("files", "src/App.jsx", GOOD_APP);
        GenerationOrchestrator gated = orchestratorWith((systemPrompt, prompt) -> {
            String request = prompt.contains("first bakery") ? "s1-first"
                    : prompt.contains("second bakery") ? "s1-second" : "s2";
            seen.add(request + ":start");
            if (request.equals("s1-first")) {
                firstEntered.countDown();
                try {
                    releaseFirst.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("interrupted");
                }
            }
            seen.add(request + ":end");
            return reply;
        });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<GenerationOutcome> first = pool.submit(
                    () -> gated.handle(GenerationRequest.generate("s1", "A first bakery page")));
            assertThat(firstEntered.await(5, TimeUnit.SECONDS)).isTrue();
            Future<GenerationOutcome> second = pool.submit(
                    () -> gated.handle(GenerationRequest.generate("s1", "A second bakery page")));
            waitForQueuedRequest("s1");

            GenerationOutcome other = gated.handle(GenerationRequest.generate("s2", "A florist page"));

            assertThat(other.success()).isTrue();
            assertThat(second.isDone()).isFalse();
            assertThat(seen).containsExactly("s1-first:start", "s2:start", "s2:end");

            releaseFirst.countDown();

            assertThat(first.get(5, TimeUnit.SECONDS).success()).isTrue();
            assertThat(second.get(5, TimeUnit.SECONDS).success()).isTrue();
            assertThat(seen).filteredOn(event -> event.startsWith("s1"))
                    .containsExactly("s1-first:start", "s1-first:end", "s1-second:start", "s1-second:end");
            assertThat(provider.createCount()).isEqualTo(2);
        } finally {
            releaseFirst.countDown();
            pool.shutdownNow();
        }
    }

    private void waitForQueuedRequest(String sessionId) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!locks.lockFor(sessionId).hasQueuedThreads()) {
            assertThat(System.nanoTime()).as("request queued on session lock").isLessThan(deadline);
            Thread.sleep(10);
        }
    }

    @Test
    void handle_sandboxCreationFails_failsBeforeGenerating() {
        provider.failAll();

        GenerationOutcome outcome = orchestrator.handle(GenerationRequest.generate("s1", "A bakery landing page"));

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.sandboxFailed()).isTrue();
        assertThat(outcome.attempts()).isZero();
        assertThat(generator.calls).isEmpty();
        assertThat(meters.counter("sitepilot.generation.outcomes", "status", "failure").count()).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Edit and restore
    // ------------------------------------------------------------------

    @Test
    void handle_editWithoutPriorApp_contractViolation() {
        GenerationOutcome outcome = orchestrator.handle(GenerationRequest.edit("s1", "Make the title amber"));

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.CONTRACT_VIOLATION);
        assertThat(generator.calls).isEmpty();
    }

    @Test
    void handle_editAfterGenerate_sendsBaselineAndApplies() {
        generator.reply(files("files", "src/App.jsx", GOOD_APP), files("files", "src/App.jsx", EDITED_APP));
        orchestrator.handle(GenerationRequest.generate("s1", "A bakery landing page"));

        GenerationOutcome outcome = orchestrator.handle(GenerationRequest.edit("s1", "Make the title amber"));

        assertThat(outcome.success()).isTrue();
        assertThat(generator.calls.get(1).prompt()).contains("Make the title amber", GOOD_APP);
        assertThat(outcome.files()).containsEntry("src/App.jsx", EDITED_APP);
        assertThat(provider.createCount()).isEqualTo(1);
    }

    @Test
    void handle_restore_appliesFilesWithoutGenerating() {
        GenerationOutcome outcome = orchestrator.handle(
                GenerationRequest.restore("s1", Map.of("src/App.jsx", GOOD_APP)));

        assertThat(outcome.success()).isTrue();
        assertThat(generator.calls).isEmpty();
        assertThat(provider.created().get(0).files()).containsEntry("my-app/src/App.jsx", GOOD_APP);
    }
}
