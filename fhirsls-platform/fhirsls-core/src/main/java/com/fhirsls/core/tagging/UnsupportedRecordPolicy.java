package com.fhirsls.core.tagging;

/**
 * What full-mode output does with entries whose resource type is not labeled.
 * Narrowed output always omits them.
 */
public enum UnsupportedRecordPolicy {
    /** Keep the entry unchanged. */
    PASS_THROUGH,
    /** Leave the entry out. */
    DROP,
    /** Keep the entry unchanged and count it in the processing summary. */
    REPORT
}
