package com.example.scenebrain_backend.orchestrator;

import com.example.scenebrain_backend.api.BrainException;
import com.example.scenebrain_backend.api.Message;
import com.example.scenebrain_backend.api.MessageRole;
import com.example.scenebrain_backend.api.OrchestrationRequest;
import com.example.scenebrain_backend.brain.AmbiguousIntentException;
import com.example.scenebrain_backend.brain.IntentSelector;
import com.example.scenebrain_backend.brain.OperationClassifier;
import com.example.scenebrain_backend.brain.ToolPlan;
import com.example.scenebrain_backend.brain.ToolSelection;
import com.example.scenebrain_backend.capability.CapabilityContext;
import com.example.scenebrain_backend.capability.CapabilityDispatcher;
import com.example.scenebrain_backend.context.ContextBuilder;
import com.example.scenebrain_backend.context.ContextBundle;
import com.example.scenebrain_backend.context.ContextUnavailableException;
import com.example.scenebrain_backend.context.OperationClass;
import com.example.scenebrain_backend.learning.PreferenceLearner;
import com.example.scenebrain_backend.memory.ConversationStore;
import com.example.scenebrain_backend.model.OrchestrationRun;
import com.example.scenebrain_backend.repository.OrchestrationRunRepository;
import com.example.scenebrain_backend.sync.VersionedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs one request end to end: classify the operation, build the tiered context, select tools and
 * execute them. Only a successful run is handed to the background learner, after its terminal event.
 * Every run ends with exactly one terminal progress event and an audit row.
 */
@Service
public class OrchestrationService {
    private static final Logger LOGGER = LoggerFactory.getLogger(OrchestrationService.class);

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";
    static final String OVERLOADED = "OVERLOADED";

    private final OperationClassifier classifier;
    private final ContextBuilder contextBuilder;
    private final IntentSelector selector;
    private final CapabilityDispatcher dispatcher;
    private final PreferenceLearner learner;
    private final ConversationStore conversationStore;
    private final OrchestrationRunRepository runRepository;
    private final ProgressStreamRegistry streams;
    private final Clock clock;
    private final Executor executor;

    public OrchestrationService(OperationClassifier classifier,
                                ContextBuilder contextBuilder,
                                IntentSelector selector,
                                CapabilityDispatcher dispatcher,
                                PreferenceLearner learner,
                                ConversationStore conversationStore,
                                OrchestrationRunRepository runRepository,
                                ProgressStreamRegistry streams,
                                Clock clock,
                                @Qualifier("orchestrationExecutor") Executor executor) {
        this.classifier = classifier;
        this.contextBuilder = contextBuilder;
        this.selector = selector;
        this.dispatcher = dispatcher;
        this.learner = learner;
        this.conversationStore = conversationStore;
        this.runRepository = runRepository;
        this.streams = streams;
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Runs the request on the calling thread.
     */
    public OrchestrationResult orchestrate(OrchestrationRequest request) {
        return orchestrate(request, ProgressListener.NOOP);
    }

    public OrchestrationResult orchestrate(OrchestrationRequest request, ProgressListener listener) {
        validate(request);
        UUID runId = UUID.randomUUID();
        return execute(runId, request, streams.open(runId, listener));
    }

    /**
     * Starts the request in the background. Progress is available from {@link ProgressStreamRegistry}
     * under the returned run id.
     */
    public UUID start(OrchestrationRequest request) {
        validate(request);
        UUID runId = UUID.randomUUID();
        ProgressStream stream = streams.open(runId, ProgressListener.NOOP);
        try {
            executor.execute(() -> execute(runId, request, stream));
        } catch (RejectedExecutionException e) {
            LOGGER.warn("orchestration queue full runId={} projectId={}", runId, request.projectId());
            stream.emit(ProgressEventType.FAILED, "Too many runs in progress, try again", Map.of("reason", OVERLOADED));
        }
        return runId;
    }

    OrchestrationResult execute(UUID runId, OrchestrationRequest request, ProgressStream stream) {
        long started = System.currentTimeMillis();
        OrchestrationRun run = new OrchestrationRun(runId, request.projectId(), request.userId(), request.prompt(),
                Instant.now(clock));
        audit(run);
        stream.emit(ProgressEventType.STARTED, "Run started", Map.of("projectId", request.projectId()));

        OperationClass operationClass = null;
        ContextBundle bundle = null;
        ToolPlan plan = null;
        List<VersionedArtifact> artifacts = new ArrayList<>();
        OrchestrationResult result;
        try {
            operationClass = classifier.classify(request);
            run.setOperationClass(operationClass.name());
            bundle = buildContext(request, operationClass);
            stream.emit(ProgressEventType.CONTEXT_READY, "Context ready", Map.of(
                    "tier", bundle.tier().name(),
                    "entities", bundle.entityList().size(),
                    "degraded", bundle.degraded()));

            plan = selector.select(request, bundle);
            List<String> tools = plan.steps().stream().map(ToolSelection::toolName).toList();
            run.setTools(String.join(",", tools));
            plan.complexity().ifPresent(c -> run.setComplexity(c.name()));
            Map<String, Object> planData = new LinkedHashMap<>();
            planData.put("tools", tools);
            plan.complexity().ifPresent(c -> planData.put("complexity", c.name()));
            stream.emit(ProgressEventType.TOOL_SELECTED, plan.reasoning() == null ? "Tools selected" : plan.reasoning(), planData);

            CapabilityContext capabilityContext = new CapabilityContext(request, bundle, runId);
            int total = plan.steps().size();
            for (int i = 0; i < total; i++) {
                ToolSelection step = plan.steps().get(i);
                VersionedArtifact artifact = dispatcher.execute(step, capabilityContext);
                artifacts.add(artifact);
                stream.emit(ProgressEventType.ARTIFACT_COMMITTED, "Saved scene", Map.of(
                        "entityId", artifact.entityId(),
                        "versionToken", artifact.versionToken()));
                stream.emit(ProgressEventType.STEP_COMPLETED, "Finished " + step.toolName(), stepData(i, total, step));
            }

            result = new OrchestrationResult(runId, RunStatus.SUCCEEDED, operationClass, tools, artifacts,
                    plan.reasoning(), null, null, null, bundle.degraded());
            stream.emit(ProgressEventType.DONE, "Done", Map.of("artifacts", artifacts.size()));
        } catch (AmbiguousIntentException e) {
            result = new OrchestrationResult(runId, RunStatus.CLARIFICATION_NEEDED, operationClass, List.of(), artifacts,
                    null, e.getQuestion(), e.getCode(), e.getMessage(), bundle != null && bundle.degraded());
            stream.emit(ProgressEventType.FAILED, e.getQuestion(), Map.of("reason", e.getCode(), "question", e.getQuestion()));
        } catch (BrainException e) {
            LOGGER.warn("orchestration failed runId={} projectId={} code={} msg={}", runId, request.projectId(),
                    e.getCode(), e.getMessage());
            result = failed(runId, operationClass, plan, artifacts, e.getCode(), e.getMessage(), bundle);
            stream.emit(ProgressEventType.FAILED, e.getMessage(), Map.of("reason", e.getCode()));
        } catch (RuntimeException e) {
            LOGGER.error("orchestration crashed runId={} projectId={}", runId, request.projectId(), e);
            result = failed(runId, operationClass, plan, artifacts, INTERNAL_ERROR, "Unexpected error", bundle);
            stream.emit(ProgressEventType.FAILED, "Unexpected error", Map.of("reason", INTERNAL_ERROR));
        } finally {
            if (!stream.isFinished()) {
                stream.emit(ProgressEventType.FAILED, "Run ended without a result", Map.of("reason", INTERNAL_ERROR));
            }
        }

        run.setStatus(result.status());
        run.setFailureCode(result.errorCode());
        run.setFailureMessage(truncate(result.errorMessage()));
        run.setFinishedAt(Instant.now(clock));
        audit(run);
        recordTurn(request, result);
        if (result.status() == RunStatus.SUCCEEDED) {
            learner.learn(request, bundle);
        }
        LOGGER.info("orchestration DONE runId={} projectId={} status={} class={} tools={} tookMs={}", runId,
                request.projectId(), result.status(), operationClass, result.tools(), System.currentTimeMillis() - started);
        return result;
    }

    private ContextBundle buildContext(OrchestrationRequest request, OperationClass operationClass) {
        try {
            return contextBuilder.build(request, operationClass);
        } catch (ContextUnavailableException e) {
            LOGGER.warn("context unavailable, continuing degraded projectId={} class={} cause={}",
                    request.projectId(), operationClass, e.getMessage());
            return contextBuilder.fallback(request, operationClass);
        }
    }

    private static OrchestrationResult failed(UUID runId, OperationClass operationClass, ToolPlan plan,
                                              List<VersionedArtifact> artifacts, String code, String message,
                                              ContextBundle bundle) {
        List<String> tools = plan == null ? List.of() : plan.steps().stream().map(ToolSelection::toolName).toList();
        return new OrchestrationResult(runId, RunStatus.FAILED, operationClass, tools, artifacts,
                plan == null ? null : plan.reasoning(), null, code, message, bundle != null && bundle.degraded());
    }

    private static Map<String, Object> stepData(int index, int total, ToolSelection step) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("index", index + 1);
        data.put("total", total);
        data.put("tool", step.toolName());
        return data;
    }

    private void audit(OrchestrationRun run) {
        try {
            runRepository.save(run);
        } catch (DataAccessException e) {
            LOGGER.warn("could not write audit row runId={}: {}", run.getId(), e.getMessage());
        }
    }

    private void recordTurn(OrchestrationRequest request, OrchestrationResult result) {
        try {
            conversationStore.append(request.projectId(),
                    new Message(MessageRole.USER, request.prompt(), request.attachedImageRefs(), null));
            conversationStore.append(request.projectId(), Message.assistant(summary(result)));
        } catch (RuntimeException e) {
            LOGGER.warn("could not record conversation turn projectId={}: {}", request.projectId(), e.getMessage());
        }
    }

    static String summary(OrchestrationResult result) {
        return switch (result.status()) {
            case SUCCEEDED -> result.reasoning() != null && !result.reasoning().isBlank()
                    ? result.reasoning()
                    : "Done: " + String.join(", ", result.tools());
            case CLARIFICATION_NEEDED -> result.clarificationQuestion();
            case FAILED -> "Failed (" + result.errorCode() + "): " + result.errorMessage();
            case RUNNING -> "";
        };
    }

    private static void validate(OrchestrationRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.projectId() == null) {
            throw new IllegalArgumentException("projectId is required");
        }
        if (request.prompt().isBlank()) {
            throw new IllegalArgumentException("prompt must not be blank");
        }
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= 2_000) {
            return value;
        }
        return value.substring(0, 2_000);
    }
}
