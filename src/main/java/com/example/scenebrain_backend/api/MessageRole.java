package com.example.scenebrain_backend.api;

public enum MessageRole {
    USER,
    ASSISTANT
}
