package com.cywriter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Output of a writer: the committed lines plus the line currently being assembled.
 */
public class LinesResult {
    private final List<String> lines = new ArrayList<>();
    private final StringBuilder current = new StringBuilder();

    /**
     * Appends to the current line without committing it.
     *
     * @throws IllegalArgumentException if {@code text} contains a line break
     */
    public void put(String text) {
        if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("Line break in output text: " + text);
        }
        current.append(text);
    }

    /**
     * Commits the current line, even if it is empty, and starts a new one.
     */
    public void newline() {
        lines.add(current.toString());
        current.setLength(0);
    }

    public void putLine(String text) {
        put(text);
        newline();
    }

    public List<String> lines() {
        return Collections.unmodifiableList(lines);
    }

    /**
     * The uncommitted text. Empty after every complete traversal.
     */
    public String pending() {
        return current.toString();
    }

    public String toSource() {
        return String.join(System.lineSeparator(), lines);
    }
}
