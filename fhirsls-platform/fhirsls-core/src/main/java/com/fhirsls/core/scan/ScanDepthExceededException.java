package com.fhirsls.core.scan;

/**
 * Thrown when a record nests deeper than the scanner is allowed to descend.
 */
public class ScanDepthExceededException extends RuntimeException {

    private final int maxDepth;

    public ScanDepthExceededException(int maxDepth) {
        super("Record nesting exceeds maximum scan depth of " + maxDepth);
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
