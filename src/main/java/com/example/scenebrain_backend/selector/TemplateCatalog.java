package com.example.scenebrain_backend.selector;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Static template catalog read once from {@code classpath:templates/catalog.json}. Order in the
 * file is the catalog order used for tie-breaks.
 */
@Component
public class TemplateCatalog {
    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateCatalog.class);
    static final String LOCATION = "templates/catalog.json";

    private final List<TemplateCandidate> candidates;

    @Autowired
    public TemplateCatalog(ObjectMapper objectMapper) {
        this(read(objectMapper, LOCATION));
    }

    public TemplateCatalog(List<TemplateCandidate> candidates) {
        this.candidates = List.copyOf(candidates);
    }

    public List<TemplateCandidate> all() {
        return candidates;
    }

    public Optional<TemplateCandidate> find(String id) {
        return candidates.stream().filter(c -> c.id().equals(id)).findFirst();
    }

    private static List<TemplateCandidate> read(ObjectMapper objectMapper, String location) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            List<Entry> entries = objectMapper.readValue(in, new TypeReference<List<Entry>>() {
            });
            List<TemplateCandidate> out = new ArrayList<>(entries.size());
            for (Entry entry : entries) {
                if (entry.id() == null || entry.id().isBlank() || entry.targetProfile() == null) {
                    throw new IllegalStateException("Catalog entry without id or targetProfile in " + location);
                }
                out.add(new TemplateCandidate(entry.id(), entry.name(), entry.targetProfile(),
                        entry.keywords() == null ? null : new LinkedHashSet<>(entry.keywords()),
                        entry.requirements()));
            }
            LOGGER.info("Template catalog loaded size={}", out.size());
            return out;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read template catalog " + location, e);
        }
    }

    private record Entry(String id, String name, ProfileVector targetProfile, List<String> keywords,
                         List<Requirement> requirements) {
    }
}
