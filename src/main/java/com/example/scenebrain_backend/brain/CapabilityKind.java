package com.example.scenebrain_backend.brain;

public enum CapabilityKind {
    CREATE,
    EDIT,
    CHANGE_ATTRIBUTE,
    CHANGE_DURATION,
    DELETE,
    UNKNOWN
}
