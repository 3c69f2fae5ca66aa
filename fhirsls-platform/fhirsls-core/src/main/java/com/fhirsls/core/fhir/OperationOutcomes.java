package com.fhirsls.core.fhir;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fhirsls.core.rules.CompilationOutcome;

/**
 * Renders outcomes as FHIR OperationOutcome resources.
 */
public final class OperationOutcomes {

    private OperationOutcomes() {
    }

    /**
     * The first issue carries the overall severity and message; each diagnostic follows as a warning.
     */
    public static ObjectNode from(CompilationOutcome outcome) {
        ObjectNode resource = base();
        ArrayNode issues = resource.putArray("issue");
        addIssue(issues, outcome.severity().code(), outcome.severity().issueType(), outcome.message());
        for (String diagnostic : outcome.diagnostics()) {
            addIssue(issues, "warning", "processing", diagnostic);
        }
        return resource;
    }

    public static ObjectNode error(String issueType, String message) {
        ObjectNode resource = base();
        addIssue(resource.putArray("issue"), "error", issueType, message);
        return resource;
    }

    private static ObjectNode base() {
        ObjectNode resource = JsonNodeFactory.instance.objectNode();
        resource.put(FhirTerms.RESOURCE_TYPE, FhirTerms.OPERATION_OUTCOME);
        return resource;
    }

    private static void addIssue(ArrayNode issues, String severity, String code, String diagnostics) {
        ObjectNode issue = issues.addObject();
        issue.put("severity", severity);
        issue.put("code", code);
        issue.put("diagnostics", diagnostics);
    }
}
