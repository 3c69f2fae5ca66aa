package com.fhirsls.api.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fhirsls.core.tagging.OutputMode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class AnalysisController {

    private final AnalysisService analysisService;

    public AnalysisController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    /**
     * Returns a batch of updates for the records that were analyzed.
     */
    @PostMapping("/analyze")
    public ResponseEntity<JsonNode> analyze(@RequestBody JsonNode bundle) {
        return ResponseEntity.ok(analysisService.analyze(bundle, OutputMode.NARROWED).bundle());
    }

    /**
     * Returns the whole input bundle with labels applied in place.
     */
    @PostMapping("/analyze-full")
    public ResponseEntity<JsonNode> analyzeFull(@RequestBody JsonNode bundle) {
        return ResponseEntity.ok(analysisService.analyze(bundle, OutputMode.FULL).bundle());
    }
}
