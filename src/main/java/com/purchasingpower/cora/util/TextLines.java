package com.purchasingpower.cora.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Line view over file content. Lines are 1-based; a trailing newline does not open an extra
 * line, and line terminators are preserved so slices concatenate back to the original text.
 */
public final class TextLines {

    private final String text;
    private final List<Integer> lineStarts;

    private TextLines(String text, List<Integer> lineStarts) {
        this.text = text;
        this.lineStarts = lineStarts;
    }

    public static TextLines of(String text) {
        List<Integer> starts = new ArrayList<>();
        if (!text.isEmpty()) {
            starts.add(0);
            for (int i = 0; i < text.length(); i++) {
                if (text.charAt(i) == '\n' && i + 1 < text.length()) {
                    starts.add(i + 1);
                }
            }
        }
        return new TextLines(text, Collections.unmodifiableList(starts));
    }

    public int count() {
        return lineStarts.size();
    }

    /** Text of a single line without its terminator. */
    public String line(int lineNumber) {
        String slice = slice(lineNumber, lineNumber);
        if (slice.endsWith("\r\n")) {
            return slice.substring(0, slice.length() - 2);
        }
        return slice.endsWith("\n") ? slice.substring(0, slice.length() - 1) : slice;
    }

    /** Verbatim text of lines {@code from..to}, inclusive, terminators included. */
    public String slice(int from, int to) {
        if (count() == 0) {
            return "";
        }
        int start = lineStarts.get(clamp(from) - 1);
        int endLine = clamp(to);
        int end = endLine < count() ? lineStarts.get(endLine) : text.length();
        return text.substring(start, end);
    }

    public int length(int from, int to) {
        return slice(from, to).length();
    }

    private int clamp(int lineNumber) {
        return Math.max(1, Math.min(lineNumber, count()));
    }
}
