package com.example.scenebrain_backend.model;

import com.example.scenebrain_backend.orchestrator.RunStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit record of one orchestration call, including the routed complexity.
 */
@Entity
@Table(name = "orchestration_run", indexes = @Index(name = "idx_run_project_started", columnList = "project_id, started_at"))
public class OrchestrationRun {
    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Column(name = "user_id", length = 255)
    private String userId;

    @Column(name = "prompt", nullable = false, length = 10_000)
    private String prompt;

    @Column(name = "operation_class", length = 32)
    private String operationClass;

    @Column(name = "tools", length = 500)
    private String tools;

    @Column(name = "complexity", length = 32)
    private String complexity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private RunStatus status = RunStatus.RUNNING;

    @Column(name = "failure_code", length = 64)
    private String failureCode;

    @Column(name = "failure_message", length = 2_000)
    private String failureMessage;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    protected OrchestrationRun() {
    }

    public OrchestrationRun(UUID id, UUID projectId, String userId, String prompt, Instant startedAt) {
        this.id = id;
        this.projectId = projectId;
        this.userId = userId;
        this.prompt = prompt;
        this.startedAt = startedAt;
        this.status = RunStatus.RUNNING;
    }

    public UUID getId() {
        return id;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public String getUserId() {
        return userId;
    }

    public String getPrompt() {
        return prompt;
    }

    public String getOperationClass() {
        return operationClass;
    }

    public void setOperationClass(String operationClass) {
        this.operationClass = operationClass;
    }

    public String getTools() {
        return tools;
    }

    public void setTools(String tools) {
        this.tools = tools;
    }

    public String getComplexity() {
        return complexity;
    }

    public void setComplexity(String complexity) {
        this.complexity = complexity;
    }

    public RunStatus getStatus() {
        return status;
    }

    public void setStatus(RunStatus status) {
        this.status = status;
    }

    public String getFailureCode() {
        return failureCode;
    }

    public void setFailureCode(String failureCode) {
        this.failureCode = failureCode;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public void setFailureMessage(String failureMessage) {
        this.failureMessage = failureMessage;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }
}
