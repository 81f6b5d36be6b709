package com.example.scenebrain_backend.api;

public record ImageRef(String id, String url) {
}
