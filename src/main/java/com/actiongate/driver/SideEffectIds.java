package com.actiongate.driver;

import java.util.List;

/**
 * Identifiers a payload would touch. {@code known=false} means extraction failed and the ids
 * are unverifiable, not empty.
 */
public record SideEffectIds(List<String> ids, boolean known) {

    public SideEffectIds {
        ids = ids == null ? List.of() : List.copyOf(ids);
    }

    public static SideEffectIds known(List<String> ids) {
        return new SideEffectIds(ids, true);
    }

    public static SideEffectIds unknown() {
        return new SideEffectIds(List.of(), false);
    }
}
