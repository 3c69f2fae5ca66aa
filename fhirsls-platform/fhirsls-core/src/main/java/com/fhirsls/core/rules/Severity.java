package com.fhirsls.core.rules;

/**
 * Overall severity of a compilation outcome, with its OperationOutcome wire values.
 */
public enum Severity {
    SUCCESS("success", "informational"),
    WARNING("warning", "processing"),
    ERROR("error", "processing");

    private final String code;
    private final String issueType;

    Severity(String code, String issueType) {
        this.code = code;
        this.issueType = issueType;
    }

    public String code() {
        return code;
    }

    public String issueType() {
        return issueType;
    }
}
