package com.fhirsls.core.rules;

import java.util.List;
import java.util.Objects;

/**
 * Result of a compilation request: overall severity, a summary message and one diagnostic
 * per rejected source.
 */
public record CompilationOutcome(
        Severity severity,
        String message,
        List<String> diagnostics,
        int sourcesCompiled,
        long tableVersion
) {

    public CompilationOutcome {
        Objects.requireNonNull(severity, "Severity cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public static CompilationOutcome success(int sourcesCompiled, long tableVersion, List<String> diagnostics) {
        return new CompilationOutcome(
                Severity.SUCCESS,
                "Successfully processed " + sourcesCompiled + " ValueSet(s)",
                diagnostics, sourcesCompiled, tableVersion
        );
    }

    public static CompilationOutcome warning(String message) {
        return new CompilationOutcome(Severity.WARNING, message, List.of(), 0, 0L);
    }

    public static CompilationOutcome error(String message) {
        return error(message, List.of());
    }

    public static CompilationOutcome error(String message, List<String> diagnostics) {
        return new CompilationOutcome(Severity.ERROR, message, diagnostics, 0, 0L);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
