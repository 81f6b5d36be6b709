package com.example.scenebrain_backend.learning;

import com.example.scenebrain_backend.api.Message;
import com.example.scenebrain_backend.api.OrchestrationRequest;
import com.example.scenebrain_backend.config.LearnerProperties;
import com.example.scenebrain_backend.context.ContextBundle;
import com.example.scenebrain_backend.context.ContextTier;
import com.example.scenebrain_backend.context.ProjectCacheRegistry;
import com.example.scenebrain_backend.memory.ConfidencePolicy;
import com.example.scenebrain_backend.memory.PreferenceScope;
import com.example.scenebrain_backend.memory.PreferenceService;
import com.example.scenebrain_backend.memory.PreferenceValue;
import com.example.scenebrain_backend.sync.StateSyncService;
import com.example.scenebrain_backend.sync.VersionedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Background learner that turns conversation turns and generated scenes into confidence-scored
 * preferences. {@link #learn} never blocks or throws; failures go to the log and to the
 * {@link LearningErrorChannel}.
 */
@Service
public class PreferenceLearner {
    private static final Logger LOGGER = LoggerFactory.getLogger(PreferenceLearner.class);

    private final LearnerProperties props;
    private final PreferenceSignalExtractor extractor;
    private final PreferenceService preferenceService;
    private final ConfidencePolicy policy;
    private final StateSyncService stateSync;
    private final LearningErrorChannel errors;
    private final ProjectCacheRegistry caches;
    private final Executor executor;

    public PreferenceLearner(LearnerProperties props,
                             PreferenceSignalExtractor extractor,
                             PreferenceService preferenceService,
                             ConfidencePolicy policy,
                             StateSyncService stateSync,
                             LearningErrorChannel errors,
                             ProjectCacheRegistry caches,
                             @Qualifier("learnerTaskExecutor") Executor executor) {
        this.props = props;
        this.extractor = extractor;
        this.preferenceService = preferenceService;
        this.policy = policy;
        this.stateSync = stateSync;
        this.errors = errors;
        this.caches = caches;
        this.executor = executor;
    }

    /**
     * Schedules learning for a completed request.
     *
     * @return {@code true} when a learning task was queued.
     */
    public boolean learn(OrchestrationRequest request, ContextBundle bundle) {
        if (!props.isEnabled()) {
            return false;
        }
        long priorTurns = request.priorUserTurns();
        if (priorTurns < props.getMinPriorTurns()) {
            LOGGER.debug("learner skipped projectId={} priorTurns={} below {}", request.projectId(), priorTurns, props.getMinPriorTurns());
            return false;
        }
        if (request.conversationHistory().size() > props.getMaxHistoryMessages()) {
            LOGGER.debug("learner skipped projectId={} history={} above cap {}", request.projectId(),
                    request.conversationHistory().size(), props.getMaxHistoryMessages());
            return false;
        }
        try {
            executor.execute(() -> runSafely(request, bundle));
            return true;
        } catch (RejectedExecutionException e) {
            LOGGER.warn("learner queue full, dropping projectId={}", request.projectId());
            errors.publish(request.projectId(), "schedule", e);
            return false;
        }
    }

    void runSafely(OrchestrationRequest request, ContextBundle bundle) {
        try {
            analyze(request, bundle);
        } catch (RuntimeException e) {
            LOGGER.error("preference learning failed projectId={}", request.projectId(), e);
            errors.publish(request.projectId(), "analyze", e);
        }
    }

    /**
     * Runs one learning pass synchronously.
     *
     * @return the preferences written by this pass.
     */
    public List<PreferenceValue> analyze(OrchestrationRequest request, ContextBundle bundle) {
        UUID projectId = request.projectId();
        List<PreferenceValue> written = new ArrayList<>();
        String prompt = request.prompt();
        List<String> userTurns = userTurns(request);
        boolean generalizing = extractor.isGeneralizing(prompt);

        for (PreferenceSignal signal : extractor.extract(prompt)) {
            if (generalizing) {
                PreferenceScope scope = extractor.isCrossProject(prompt) ? PreferenceScope.GLOBAL : PreferenceScope.PROJECT;
                written.add(preferenceService.recordExplicit(projectId, signal.key(), signal.value(), scope));
                continue;
            }
            int occurrences = occurrences(signal, userTurns);
            if (occurrences >= policy.repeatThreshold()) {
                preferenceService.reinforcePattern(projectId, signal.key(), signal.value(), occurrences).ifPresent(written::add);
                continue;
            }
            Optional<PreferenceValue> current = preferenceService.winner(projectId, signal.key());
            if (current.isPresent() && !current.get().value().equals(signal.value()) && policy.isHigh(current.get().confidence())) {
                LOGGER.debug("one-time instruction kept out of preferences projectId={} key={} value={} stored={}",
                        projectId, signal.key(), signal.value(), current.get().value());
            } else {
                LOGGER.trace("evidence below threshold projectId={} key={} value={} occurrences={}",
                        projectId, signal.key(), signal.value(), occurrences);
            }
        }

        if (mayHaveRepeatedScenes(bundle)) {
            written.addAll(inferFromScenes(projectId));
        }
        if (!written.isEmpty()) {
            caches.invalidatePreferences(projectId);
            LOGGER.info("learner pass DONE projectId={} written={}", projectId, written.size());
        }
        return written;
    }

    private List<PreferenceValue> inferFromScenes(UUID projectId) {
        Map<PreferenceSignal, Integer> counts = new LinkedHashMap<>();
        for (VersionedArtifact scene : stateSync.listLive(projectId)) {
            Set<PreferenceSignal> seen = new HashSet<>();
            scene.payload().attributes().forEach((key, value) -> {
                if (value != null && !value.isBlank()) {
                    seen.add(new PreferenceSignal(key, value));
                }
            });
            seen.forEach(s -> counts.merge(s, 1, Integer::sum));
        }
        List<PreferenceValue> out = new ArrayList<>();
        counts.forEach((signal, count) -> {
            if (count >= policy.repeatThreshold()) {
                preferenceService.recordInferred(projectId, signal.key(), signal.value()).ifPresent(out::add);
            }
        });
        return out;
    }

    // the light tier carries no entity list, so it cannot rule anything out
    private boolean mayHaveRepeatedScenes(ContextBundle bundle) {
        return bundle == null || bundle.tier() == ContextTier.LIGHT || bundle.entityList().size() >= policy.repeatThreshold();
    }

    private int occurrences(PreferenceSignal signal, List<String> userTurns) {
        int count = 0;
        for (String turn : userTurns) {
            if (extractor.extract(turn).contains(signal)) {
                count++;
            }
        }
        return count;
    }

    private static List<String> userTurns(OrchestrationRequest request) {
        List<String> turns = new ArrayList<>();
        for (Message message : request.conversationHistory()) {
            if (message.isUser()) {
                turns.add(message.content());
            }
        }
        if (turns.isEmpty() || !turns.get(turns.size() - 1).equals(request.prompt())) {
            turns.add(request.prompt());
        }
        return turns;
    }
}
