package com.adlanda.codecontext.chunking;

import com.adlanda.codecontext.model.FragmentKind;

import java.util.regex.Pattern;

/**
 * A line pattern that opens a new fragment of the given kind.
 */
record BoundaryPattern(Pattern regex, FragmentKind kind) {

    static BoundaryPattern of(String regex, FragmentKind kind) {
        return new BoundaryPattern(Pattern.compile(regex), kind);
    }

    boolean matches(String trimmedLine) {
        return regex.matcher(trimmedLine).find();
    }
}
