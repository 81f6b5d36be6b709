package com.example.scenebrain_backend.memory;

public enum PreferenceScope {
    GLOBAL,
    PROJECT
}
