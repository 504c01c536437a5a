package com.adlanda.codecontext.chunking;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A line pattern whose capture group names a dependency or an exported symbol.
 */
record CapturePattern(Pattern regex, int group) {

    static CapturePattern of(String regex, int group) {
        return new CapturePattern(Pattern.compile(regex), group);
    }

    Optional<String> capture(String trimmedLine) {
        Matcher matcher = regex.matcher(trimmedLine);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.ofNullable(matcher.group(group)).filter(s -> !s.isBlank());
    }
}
