package com.example.scenebrain_backend.selector;

public record ScoredTemplate(TemplateCandidate candidate, double score, ScoreBreakdown breakdown, String reasoning) {
}
