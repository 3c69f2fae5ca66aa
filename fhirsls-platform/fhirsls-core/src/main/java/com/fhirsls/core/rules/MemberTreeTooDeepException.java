package com.fhirsls.core.rules;

/**
 * Thrown when a source's member tree nests beyond the configured bound.
 */
public class MemberTreeTooDeepException extends RuntimeException {

    public MemberTreeTooDeepException(int maxDepth) {
        super("member codes nest deeper than " + maxDepth + " levels");
    }
}
