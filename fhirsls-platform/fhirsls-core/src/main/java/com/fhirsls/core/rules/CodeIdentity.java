package com.fhirsls.core.rules;

import java.util.Objects;

/**
 * A terminology code as matched against the rule table: (system, code), compared by exact value.
 */
public record CodeIdentity(String system, String code) {

    public CodeIdentity {
        Objects.requireNonNull(system, "System cannot be null");
        Objects.requireNonNull(code, "Code cannot be null");
    }

    @Override
    public String toString() {
        return system + "|" + code;
    }
}
