package com.example.scenebrain_backend.brain;

import com.example.scenebrain_backend.api.ImageRef;
import com.example.scenebrain_backend.api.Message;
import com.example.scenebrain_backend.api.OrchestrationRequest;
import com.example.scenebrain_backend.context.ContextBundle;
import com.example.scenebrain_backend.context.EntitySummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns references such as "scene 2", "the third one", "the last scene" or "the first image" into
 * concrete ids.
 * <p>
 * Scene positions count live scenes in introduction order, the same order that produces the
 * "Scene N" labels. Image positions count images in the order they entered the conversation, with
 * the images attached to the current request last.
 * <p>
 * Resolution order: an explicit attachment on the request, then a positional reference, then the
 * id the model picked, then the most recent candidate.
 */
@Component
public class ReferenceResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReferenceResolver.class);

    private static final Map<String, Integer> ORDINAL_WORDS = Map.ofEntries(
            Map.entry("first", 1), Map.entry("second", 2), Map.entry("third", 3), Map.entry("fourth", 4),
            Map.entry("fifth", 5), Map.entry("sixth", 6), Map.entry("seventh", 7), Map.entry("eighth", 8),
            Map.entry("ninth", 9), Map.entry("tenth", 10));

    private static final String NOUN = "(scene|slide|clip|one|image|picture|photo|screenshot)";

    private static final Pattern NUMBERED = Pattern.compile(
            "\\b(scene|slide|image|picture|photo|screenshot)\\s*(?:#|number\\s*)?(\\d{1,3})\\b"
                    + "(?!\\s*(?:seconds?|secs?|s|frames?|minutes?|mins?)\\b)");

    private static final Pattern ORDINAL = Pattern.compile(
            "\\b(?:the\\s+)?(first|second|third|fourth|fifth|sixth|seventh|eighth|ninth|tenth|\\d{1,3}(?:st|nd|rd|th))\\s+"
                    + NOUN + "\\b");

    private static final String FROM_END = "(second[- ]to[- ]last|penultimate|last|final|latest)";

    private static final Pattern FROM_END_NOUN = Pattern.compile("\\b(?:the\\s+)?" + FROM_END + "\\s+" + NOUN + "\\b");

    private static final Pattern FROM_END_BARE = Pattern.compile("\\bthe\\s+" + FROM_END + "\\b(?!\\s*\\d)");

    /**
     * Where a positional reference points.
     *
     * @param position 1-based from the start, or from the end when {@code fromEnd} is set.
     */
    public record Position(boolean image, int position, boolean fromEnd) {

        int index(int size) {
            return fromEnd ? size - position : position - 1;
        }
    }

    /**
     * First positional reference to a scene ({@code image == false}) or an image in {@code text}.
     */
    public Optional<Position> parse(String text, boolean image) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        Matcher numbered = NUMBERED.matcher(lower);
        while (numbered.find()) {
            if (isImageNoun(numbered.group(1)) == image) {
                return Optional.of(new Position(image, Integer.parseInt(numbered.group(2)), false));
            }
        }
        Matcher ordinal = ORDINAL.matcher(lower);
        while (ordinal.find()) {
            if (isImageNoun(ordinal.group(2)) == image) {
                return Optional.of(new Position(image, ordinalValue(ordinal.group(1)), false));
            }
        }
        Matcher end = FROM_END_NOUN.matcher(lower);
        while (end.find()) {
            if (isImageNoun(end.group(2)) == image) {
                return Optional.of(new Position(image, fromEndValue(end.group(1)), true));
            }
        }
        if (!image) {
            Matcher bare = FROM_END_BARE.matcher(lower);
            if (bare.find()) {
                return Optional.of(new Position(false, fromEndValue(bare.group(1)), true));
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves the scene a step operates on.
     *
     * @param reference      the reference text of the step, usually the prompt.
     * @param modelTargetId  the id the model picked, may be {@code null} or invalid.
     * @param allowMostRecent whether an unreferenced step may fall back to the latest scene.
     * @throws AmbiguousIntentException when no scene can be chosen without asking.
     */
    public UUID resolveScene(OrchestrationRequest request, ContextBundle bundle, String reference,
                             String modelTargetId, boolean allowMostRecent) {
        if (request.targetEntityId() != null) {
            return request.targetEntityId();
        }
        List<EntitySummary> scenes = bundle.entityList();
        Optional<Position> position = parse(reference, false);
        if (position.isPresent()) {
            int index = position.get().index(scenes.size());
            if (index < 0 || index >= scenes.size()) {
                throw new AmbiguousIntentException(outOfRange(scenes.size(), "scene"));
            }
            return scenes.get(index).entityId();
        }
        Optional<UUID> picked = parseUuid(modelTargetId)
                .filter(id -> scenes.stream().anyMatch(s -> s.entityId().equals(id)));
        if (picked.isPresent()) {
            return picked.get();
        }
        if (modelTargetId != null && !modelTargetId.isBlank()) {
            LOGGER.debug("Ignoring unknown model target {}", modelTargetId);
        }
        if (scenes.isEmpty()) {
            throw new AmbiguousIntentException("There are no scenes yet. Would you like me to create one?");
        }
        if (scenes.size() == 1 || allowMostRecent) {
            return scenes.get(scenes.size() - 1).entityId();
        }
        throw new AmbiguousIntentException("Which scene do you mean? There are " + scenes.size() + " scenes.");
    }

    /**
     * Resolves the image a step uses, or empty when the step needs none.
     */
    public Optional<ImageRef> resolveImage(OrchestrationRequest request, String reference, String modelImageRefId) {
        List<ImageRef> attached = request.attachedImageRefs();
        List<ImageRef> all = conversationImages(request);
        Optional<Position> position = parse(reference, true);
        if (!attached.isEmpty()) {
            if (attached.size() == 1) {
                return Optional.of(attached.get(0));
            }
            if (position.isPresent()) {
                return Optional.of(pick(attached, position.get()));
            }
            return byId(attached, modelImageRefId).or(() -> Optional.of(attached.get(0)));
        }
        if (position.isPresent()) {
            return Optional.of(pick(all, position.get()));
        }
        Optional<ImageRef> picked = byId(all, modelImageRefId);
        if (picked.isPresent()) {
            return picked;
        }
        if (modelImageRefId != null && !modelImageRefId.isBlank() && !all.isEmpty()) {
            return Optional.of(all.get(all.size() - 1));
        }
        return Optional.empty();
    }

    /**
     * Images in the order they entered the conversation, deduplicated by id.
     */
    public List<ImageRef> conversationImages(OrchestrationRequest request) {
        Map<String, ImageRef> ordered = new LinkedHashMap<>();
        for (Message message : request.conversationHistory()) {
            for (ImageRef ref : message.imageRefs()) {
                ordered.putIfAbsent(ref.id(), ref);
            }
        }
        for (ImageRef ref : request.attachedImageRefs()) {
            ordered.putIfAbsent(ref.id(), ref);
        }
        return new ArrayList<>(ordered.values());
    }

    private ImageRef pick(List<ImageRef> images, Position position) {
        int index = position.index(images.size());
        if (index < 0 || index >= images.size()) {
            throw new AmbiguousIntentException(outOfRange(images.size(), "image"));
        }
        return images.get(index);
    }

    private static Optional<ImageRef> byId(List<ImageRef> images, String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return images.stream().filter(i -> i.id().equals(id)).findFirst();
    }

    private static String outOfRange(int size, String noun) {
        if (size == 0) {
            return "There is no " + noun + " yet. Which one do you mean?";
        }
        return "There " + (size == 1 ? "is only 1 " + noun : "are only " + size + " " + noun + "s")
                + ". Which one do you mean?";
    }

    private static boolean isImageNoun(String noun) {
        return noun != null && (noun.equals("image") || noun.equals("picture") || noun.equals("photo")
                || noun.equals("screenshot"));
    }

    private static int fromEndValue(String word) {
        return word.startsWith("second") || word.equals("penultimate") ? 2 : 1;
    }

    private static int ordinalValue(String word) {
        Integer named = ORDINAL_WORDS.get(word);
        if (named != null) {
            return named;
        }
        return Integer.parseInt(word.replaceAll("\\D", ""));
    }

    private static Optional<UUID> parseUuid(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
