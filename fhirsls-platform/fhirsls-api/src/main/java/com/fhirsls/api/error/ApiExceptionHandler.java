package com.fhirsls.api.error;

import com.fasterxml.jackson.databind.JsonNode;
import com.fhirsls.core.fhir.OperationOutcomes;
import com.fhirsls.core.tagging.TaggingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Turns failures into FHIR OperationOutcome bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TaggingException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public JsonNode handleTagging(TaggingException ex) {
        return OperationOutcomes.error("processing", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public JsonNode handleUnreadable(HttpMessageNotReadableException ex) {
        return OperationOutcomes.error("invalid", "Request body is required and must be JSON");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<JsonNode> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // framework-level rejections (unknown path, wrong method) keep their status
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(OperationOutcomes.error("not-supported", ex.getMessage()));
        }
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(OperationOutcomes.error("exception", "Server error: " + ex.getMessage()));
    }
}
