package com.fhirsls.core.tagging;

/**
 * Thrown when a tagging request is not a bundle, has no entries, or holds a record the
 * scanner refuses to walk.
 */
public class InvalidBundleException extends TaggingException {

    public InvalidBundleException(String message) {
        super(message);
    }

    public InvalidBundleException(String message, Throwable cause) {
        super(message, cause);
    }
}
