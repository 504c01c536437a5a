package com.adlanda.codecontext.chunking;

import java.util.ArrayList;
import java.util.List;

/**
 * Line splitting shared by chunking and project statistics, so that fragment
 * line ranges and reported line counts always agree.
 */
public final class SourceLines {

    private SourceLines() {
    }

    /**
     * Splits text on '\n', dropping a trailing '\r' from each line.
     * Empty or null text is a single empty line.
     */
    public static List<String> split(String content) {
        if (content == null || content.isEmpty()) {
            return List.of("");
        }
        String[] raw = content.split("\n", -1);
        List<String> lines = new ArrayList<>(raw.length);
        for (String line : raw) {
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        return lines;
    }

    public static int count(String content) {
        if (content == null || content.isEmpty()) {
            return 1;
        }
        int count = 1;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
