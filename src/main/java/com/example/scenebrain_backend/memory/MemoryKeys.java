package com.example.scenebrain_backend.memory;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Key layout of the memory store. Preferences are stored one row per (key, value) pair so that
 * competing values keep their own confidence.
 */
public final class MemoryKeys {

    public static final String PREFERENCE_PREFIX = "preference:";
    public static final String IMAGE_PREFIX = "image:";
    public static final String SCENE_RELATION_PREFIX = "scene-rel:";
    public static final String BRAND_PROFILE = "brand:profile";

    private MemoryKeys() {
    }

    public static String preference(String key, String value) {
        return PREFERENCE_PREFIX + normalize(key) + "=" + normalize(value);
    }

    public static String preferencePrefix(String key) {
        return PREFERENCE_PREFIX + normalize(key) + "=";
    }

    public static String image(String imageRefId) {
        return IMAGE_PREFIX + imageRefId;
    }

    public static String sceneRelation(UUID entityId) {
        return SCENE_RELATION_PREFIX + entityId;
    }

    /**
     * Splits a preference storage key back into its preference key and value.
     */
    public static Optional<String[]> parsePreference(String storageKey) {
        if (storageKey == null || !storageKey.startsWith(PREFERENCE_PREFIX)) {
            return Optional.empty();
        }
        String rest = storageKey.substring(PREFERENCE_PREFIX.length());
        int eq = rest.indexOf('=');
        if (eq <= 0 || eq == rest.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(new String[]{rest.substring(0, eq), rest.substring(eq + 1)});
    }

    public static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
