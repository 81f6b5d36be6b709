package com.example.scenebrain_backend.dto;

public record ErrorResponse(String code, String message) {
}
