package com.example.scenebrain_backend.controller;

import com.example.scenebrain_backend.dto.ScoredTemplateResponse;
import com.example.scenebrain_backend.dto.TemplateScoreRequest;
import com.example.scenebrain_backend.selector.TemplateCandidate;
import com.example.scenebrain_backend.selector.TemplateCatalog;
import com.example.scenebrain_backend.selector.TemplateScoringEngine;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/templates")
public class TemplateController {

    private final TemplateCatalog catalog;
    private final TemplateScoringEngine scoringEngine;

    public TemplateController(TemplateCatalog catalog, TemplateScoringEngine scoringEngine) {
        this.catalog = catalog;
        this.scoringEngine = scoringEngine;
    }

    @GetMapping
    public List<TemplateCandidate> list() {
        return catalog.all();
    }

    @PostMapping("/score")
    public List<ScoredTemplateResponse> score(@Valid @RequestBody TemplateScoreRequest request) {
        return scoringEngine.score(request.profile().toDomain(), catalog.all(), request.content()).stream()
                .map(ScoredTemplateResponse::from)
                .toList();
    }
}
