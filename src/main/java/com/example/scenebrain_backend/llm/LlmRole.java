package com.example.scenebrain_backend.llm;

public enum LlmRole {
    SYSTEM,
    USER
}
