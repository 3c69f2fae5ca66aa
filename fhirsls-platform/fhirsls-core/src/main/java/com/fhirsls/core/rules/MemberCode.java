package com.fhirsls.core.rules;

import java.util.List;

/**
 * One node of a topic source's member tree. System and code may be absent on grouping
 * nodes that only hold nested members.
 */
public record MemberCode(
        String system,
        String code,
        String display,
        List<MemberCode> contains
) {

    public MemberCode {
        contains = contains != null ? List.copyOf(contains) : List.of();
    }

    public static MemberCode leaf(String system, String code) {
        return new MemberCode(system, code, null, List.of());
    }

    public static MemberCode group(List<MemberCode> contains) {
        return new MemberCode(null, null, null, contains);
    }

    public boolean isCoded() {
        return system != null && !system.isBlank() && code != null && !code.isBlank();
    }

    public CodeIdentity identity() {
        if (!isCoded()) {
            throw new IllegalStateException("Member has no code identity");
        }
        return new CodeIdentity(system, code);
    }
}
