package com.adlanda.codecontext.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Structural kind of a source fragment.
 */
public enum FragmentKind {
    FUNCTION,
    CLASS,
    INTERFACE,
    BLOCK,
    OTHER;

    /**
     * Lower-case tag used in prompts and JSON responses.
     */
    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
