package com.example.scenebrain_backend.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Preference view over the memory store. Preferences are never deleted: a contradicted value keeps
 * its row with lowered confidence.
 */
@Service
public class PreferenceService {
    private static final Logger LOGGER = LoggerFactory.getLogger(PreferenceService.class);

    private static final Comparator<PreferenceValue> WINNER_ORDER = Comparator
            .comparingDouble(PreferenceValue::confidence)
            .thenComparing(PreferenceValue::updatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .reversed();

    private final MemoryStore memoryStore;
    private final ConfidencePolicy policy;

    public PreferenceService(MemoryStore memoryStore, ConfidencePolicy policy) {
        this.memoryStore = memoryStore;
        this.policy = policy;
    }

    public List<PreferenceValue> all(UUID projectId) {
        return memoryStore.list(projectId, MemoryKeys.PREFERENCE_PREFIX).stream()
                .filter(e -> MemoryKeys.parsePreference(e.key()).isPresent())
                .map(PreferenceValue::fromEntry)
                .toList();
    }

    public List<PreferenceValue> values(UUID projectId, String key) {
        return memoryStore.list(projectId, MemoryKeys.preferencePrefix(key)).stream()
                .map(PreferenceValue::fromEntry)
                .sorted(WINNER_ORDER)
                .toList();
    }

    /**
     * Resolves the active value per preference key: highest confidence, then most recent. Values
     * below the publish threshold never win.
     *
     * @return immutable map keyed by preference key, in key order.
     */
    public Map<String, PreferenceValue> resolve(UUID projectId) {
        Map<String, List<PreferenceValue>> byKey = all(projectId).stream()
                .filter(p -> policy.isPublishable(p.confidence()))
                .collect(Collectors.groupingBy(PreferenceValue::key, TreeMap::new, Collectors.toList()));
        Map<String, PreferenceValue> winners = new LinkedHashMap<>();
        byKey.forEach((key, candidates) -> winners.put(key, candidates.stream().sorted(WINNER_ORDER).findFirst().orElseThrow()));
        return Collections.unmodifiableMap(winners);
    }

    public Optional<PreferenceValue> winner(UUID projectId, String key) {
        return values(projectId, key).stream().filter(p -> policy.isPublishable(p.confidence())).findFirst();
    }

    /**
     * Stores an explicit statement. Competing values of the same key lose exactly one contradiction
     * decrement each.
     */
    public PreferenceValue recordExplicit(UUID projectId, String key, String value, PreferenceScope scope) {
        String normalizedValue = MemoryKeys.normalize(value);
        List<PreferenceValue> existing = values(projectId, key);
        double confidence = policy.explicitStart();
        for (PreferenceValue other : existing) {
            if (other.value().equals(normalizedValue)) {
                confidence = Math.max(confidence, other.confidence());
                continue;
            }
            double lowered = policy.contradict(other.confidence());
            memoryStore.put(projectId, MemoryKeys.preference(key, other.value()), other.value(), lowered,
                    other.scope(), other.source());
            LOGGER.debug("preference contradicted projectId={} key={} value={} {} -> {}", projectId, key, other.value(),
                    other.confidence(), lowered);
        }
        MemoryEntry saved = memoryStore.put(projectId, MemoryKeys.preference(key, normalizedValue), normalizedValue,
                confidence, scope == null ? PreferenceScope.PROJECT : scope, PreferenceSource.EXPLICIT);
        LOGGER.info("preference recorded projectId={} key={} value={} confidence={} source=EXPLICIT",
                projectId, key, normalizedValue, confidence);
        return PreferenceValue.fromEntry(saved);
    }

    /**
     * Records one more recurrence of a concrete pattern seen {@code occurrences} times so far.
     *
     * @return the stored preference, empty when the evidence stays below the publish threshold.
     */
    public Optional<PreferenceValue> reinforcePattern(UUID projectId, String key, String value, int occurrences) {
        String normalizedValue = MemoryKeys.normalize(value);
        String storageKey = MemoryKeys.preference(key, normalizedValue);
        Optional<MemoryEntry> current = memoryStore.get(projectId, storageKey);
        double confidence;
        PreferenceSource source;
        PreferenceScope scope;
        if (current.isPresent()) {
            PreferenceValue existing = PreferenceValue.fromEntry(current.get());
            confidence = policy.reinforce(existing.confidence());
            source = existing.source();
            scope = existing.scope();
        } else {
            confidence = policy.patternStart(occurrences);
            source = PreferenceSource.PATTERN;
            scope = PreferenceScope.PROJECT;
        }
        if (!policy.isPublishable(confidence)) {
            LOGGER.debug("pattern below publish threshold projectId={} key={} value={} confidence={}",
                    projectId, key, normalizedValue, confidence);
            return Optional.empty();
        }
        MemoryEntry saved = memoryStore.put(projectId, storageKey, normalizedValue, confidence, scope, source);
        LOGGER.info("preference reinforced projectId={} key={} value={} confidence={} occurrences={}",
                projectId, key, normalizedValue, confidence, occurrences);
        return Optional.of(PreferenceValue.fromEntry(saved));
    }

    /**
     * Stores a preference inferred from generated artifacts unless one already exists for the pair.
     */
    public Optional<PreferenceValue> recordInferred(UUID projectId, String key, String value) {
        String normalizedValue = MemoryKeys.normalize(value);
        String storageKey = MemoryKeys.preference(key, normalizedValue);
        if (memoryStore.get(projectId, storageKey).isPresent()) {
            return Optional.empty();
        }
        double confidence = policy.inferredStart();
        if (!policy.isPublishable(confidence)) {
            return Optional.empty();
        }
        MemoryEntry saved = memoryStore.put(projectId, storageKey, normalizedValue, confidence,
                PreferenceScope.PROJECT, PreferenceSource.INFERRED);
        LOGGER.info("preference inferred projectId={} key={} value={} confidence={}", projectId, key, normalizedValue, confidence);
        return Optional.of(PreferenceValue.fromEntry(saved));
    }
}
