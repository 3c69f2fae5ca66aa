package com.fhirsls.api.valueset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fhirsls.core.fhir.OperationOutcomes;
import com.fhirsls.core.rules.CompilationOutcome;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/valuesets")
public class ValueSetController {

    private final ValueSetService valueSetService;

    public ValueSetController(ValueSetService valueSetService) {
        this.valueSetService = valueSetService;
    }

    /**
     * Accepts a ValueSet or a Bundle of ValueSets and answers with an OperationOutcome.
     */
    @PostMapping
    public ResponseEntity<JsonNode> load(@RequestBody JsonNode valueSets) {
        CompilationOutcome outcome = valueSetService.load(valueSets);
        HttpStatus status = outcome.isError() ? HttpStatus.BAD_REQUEST : HttpStatus.OK;
        return ResponseEntity.status(status).body(OperationOutcomes.from(outcome));
    }
}
