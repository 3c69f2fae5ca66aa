package com.fhirsls.core.tagging;

/**
 * Thrown when records are submitted for tagging before any rules have been compiled.
 */
public class RulesNotLoadedException extends TaggingException {

    public RulesNotLoadedException() {
        super("No sensitive topic rules loaded. Please process ValueSets first.");
    }
}
