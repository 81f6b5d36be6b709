package com.example.scenebrain_backend.selector;

public record ScoreBreakdown(double profileMatch, double keywordMatch, double contentAvailability) {
}
