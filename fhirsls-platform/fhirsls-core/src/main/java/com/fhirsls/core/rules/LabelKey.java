package com.fhirsls.core.rules;

import java.util.Objects;

/**
 * Identity of a security label: (system, code). Display text takes no part in it.
 * The system may be null for codings that omit it.
 */
public record LabelKey(String system, String code) {

    public LabelKey {
        Objects.requireNonNull(code, "Code cannot be null");
    }
}
