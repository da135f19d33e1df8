package com.sitepilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One generate, edit or restore request and its final outcome.
 *
 * DB table: generation_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "generation_runs")
public class GenerationRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "session_id", nullable = false)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunKind kind;

    @Column(columnDefinition = "TEXT")
    private String prompt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunState state = RunState.QUEUED;

    // Set for RESTORE runs: the run whose files were re-applied.
    @Column(name = "restored_from")
    private UUID restoredFrom;

    @Column(name = "success")
    private Boolean success;

    @Column(name = "url")
    private String url;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @Column(name = "sandbox_failed", nullable = false)
    private boolean sandboxFailed = false;

    @Column(name = "failure_kind")
    private String failureKind;

    @Column(name = "attempts", nullable = false)
    private int attempts = 0;

    // JSON object of project-relative path -> content, captured after a
    // successful run. Source for RESTORE.
    @Column(name = "files_json", columnDefinition = "TEXT")
    private String filesJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected GenerationRun() {}   // required by JPA

    public GenerationRun(String sessionId, RunKind kind, String prompt) {
        this.sessionId = sessionId;
        this.kind      = kind;
        this.prompt    = prompt;
    }

    // ------------------------------------------------------------------
    // State transitions
    // ------------------------------------------------------------------

    public void markRunning() {
        this.state     = RunState.RUNNING;
        this.startedAt = Instant.now();
    }

    public void markCancelled(String reason) {
        this.state      = RunState.CANCELLED;
        this.success    = false;
        this.error      = reason;
        this.finishedAt = Instant.now();
    }

    public void finish(boolean success, String url, String error, boolean sandboxFailed,
                       String failureKind, int attempts, String filesJson) {
        this.state         = success ? RunState.SUCCEEDED : RunState.FAILED;
        this.success       = success;
        this.url           = url;
        this.error         = error;
        this.sandboxFailed = sandboxFailed;
        this.failureKind   = failureKind;
        this.attempts      = attempts;
        this.filesJson     = filesJson;
        this.finishedAt    = Instant.now();
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID     getId()            { return id; }
    public String   getSessionId()     { return sessionId; }
    public RunKind  getKind()          { return kind; }
    public String   getPrompt()        { return prompt; }
    public RunState getState()         { return state; }
    public Boolean  getSuccess()       { return success; }
    public String   getUrl()           { return url; }
    public String   getError()         { return error; }
    public boolean  isSandboxFailed()  { return sandboxFailed; }
    public String   getFailureKind()   { return failureKind; }
    public int      getAttempts()      { return attempts; }
    public String   getFilesJson()     { return filesJson; }
    public Instant  getCreatedAt()     { return createdAt; }
    public Instant  getUpdatedAt()     { return updatedAt; }
    public Instant  getStartedAt()     { return startedAt; }
    public Instant  getFinishedAt()    { return finishedAt; }

    public UUID getRestoredFrom()                 { return restoredFrom; }
    public void setRestoredFrom(UUID restoredFrom) { this.restoredFrom = restoredFrom; }

    // Used by tests that build runs without a database.
    public void setId(UUID id)                     { this.id = id; }
}
