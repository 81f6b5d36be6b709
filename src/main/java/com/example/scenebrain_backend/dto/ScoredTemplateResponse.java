package com.example.scenebrain_backend.dto;

import com.example.scenebrain_backend.selector.ScoredTemplate;

public record ScoredTemplateResponse(String id,
                                     String name,
                                     double score,
                                     double profileMatch,
                                     double keywordMatch,
                                     double contentAvailability,
                                     String reasoning) {

    public static ScoredTemplateResponse from(ScoredTemplate scored) {
        return new ScoredTemplateResponse(scored.candidate().id(), scored.candidate().name(), scored.score(),
                scored.breakdown().profileMatch(), scored.breakdown().keywordMatch(),
                scored.breakdown().contentAvailability(), scored.reasoning());
    }
}
