package com.fhirsls.core.tagging;

/**
 * Shape of the bundle returned by a tagging request.
 */
public enum OutputMode {
    /** Only the records that were scanned, each as a PUT entry of a batch bundle. */
    NARROWED,
    /** Every input entry in its original position, annotated in place where scanned. */
    FULL
}
