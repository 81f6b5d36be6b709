package com.example.scenebrain_backend.memory;

public enum MemoryType {
    PREFERENCE,
    IMAGE_FACT,
    SCENE_RELATIONSHIP,
    BRAND_PROFILE,
    OTHER;

    public static MemoryType fromKey(String key) {
        if (key == null) {
            return OTHER;
        }
        if (key.startsWith(MemoryKeys.PREFERENCE_PREFIX)) {
            return PREFERENCE;
        }
        if (key.startsWith(MemoryKeys.IMAGE_PREFIX)) {
            return IMAGE_FACT;
        }
        if (key.startsWith(MemoryKeys.SCENE_RELATION_PREFIX)) {
            return SCENE_RELATIONSHIP;
        }
        if (key.equals(MemoryKeys.BRAND_PROFILE)) {
            return BRAND_PROFILE;
        }
        return OTHER;
    }
}
