package com.fhirsls.core.tagging;

/**
 * Base for failures that reject a whole tagging request before any output is produced.
 */
public abstract class TaggingException extends RuntimeException {

    protected TaggingException(String message) {
        super(message);
    }

    protected TaggingException(String message, Throwable cause) {
        super(message, cause);
    }
}
