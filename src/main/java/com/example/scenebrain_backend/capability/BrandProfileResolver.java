package com.example.scenebrain_backend.capability;

import com.example.scenebrain_backend.api.OrchestrationRequest;
import com.example.scenebrain_backend.memory.MemoryEntry;
import com.example.scenebrain_backend.memory.MemoryKeys;
import com.example.scenebrain_backend.memory.MemoryStore;
import com.example.scenebrain_backend.selector.BrandProfile;
import com.example.scenebrain_backend.selector.BrandProfileDeriver;
import com.example.scenebrain_backend.selector.BrandSignals;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the brand profile a new scene is matched against: the request's own, the project's stored
 * brand signals, or signals read off the prompt.
 */
@Component
public class BrandProfileResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(BrandProfileResolver.class);

    private final MemoryStore memoryStore;
    private final BrandProfileDeriver deriver;
    private final ObjectMapper objectMapper;

    public BrandProfileResolver(MemoryStore memoryStore, BrandProfileDeriver deriver, ObjectMapper objectMapper) {
        this.memoryStore = memoryStore;
        this.deriver = deriver;
        this.objectMapper = objectMapper;
    }

    public BrandProfile resolve(OrchestrationRequest request) {
        if (request.brandProfile() != null) {
            return request.brandProfile();
        }
        return storedSignals(request)
                .or(() -> Optional.of(fromPrompt(request.prompt())))
                .map(deriver::derive)
                .get();
    }

    private Optional<BrandSignals> storedSignals(OrchestrationRequest request) {
        Optional<MemoryEntry> entry = memoryStore.get(request.projectId(), MemoryKeys.BRAND_PROFILE);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(entry.get().value(), BrandSignals.class));
        } catch (JsonProcessingException e) {
            LOGGER.warn("Unreadable brand profile projectId={}: {}", request.projectId(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    static BrandSignals fromPrompt(String prompt) {
        List<String> words = Arrays.stream(prompt.toLowerCase(Locale.ROOT).split("[^a-z0-9-]+"))
                .filter(w -> w.length() > 2)
                .distinct()
                .toList();
        return new BrandSignals(words, prompt, List.of(), 0, null, words);
    }
}
