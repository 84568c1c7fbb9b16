package org.dxworks.jovialframe.analyzer.lexer;

import org.dxworks.jovialframe.model.Position;
import org.dxworks.jovialframe.model.Span;

import java.util.Arrays;

/**
 * Maps character offsets of a text to 0-based line/column pairs and back. Lines end at {@code '\n'}.
 */
public final class LineIndex {

    private final int[] lineStarts;
    private final int length;

    public LineIndex(String text) {
        int[] starts = new int[16];
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, count);
        this.length = text.length();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    public int lineOf(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        int index = Arrays.binarySearch(lineStarts, clamped);
        return index >= 0 ? index : -index - 2;
    }

    public int columnOf(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        return clamped - lineStarts[lineOf(clamped)];
    }

    public int lineStart(int line) {
        return lineStarts[Math.max(0, Math.min(line, lineStarts.length - 1))];
    }

    /**
     * Offset of an editor position; positions past the end of a line or of the text are clamped.
     */
    public int offsetOf(Position position) {
        if (position.getLine() >= lineStarts.length) {
            return length;
        }
        int start = lineStart(position.getLine());
        int lineEnd = position.getLine() + 1 < lineStarts.length ? lineStarts[position.getLine() + 1] - 1 : length;
        return Math.min(start + Math.max(0, position.getCharacter()), lineEnd);
    }

    public Span span(int startOffset, int endOffset) {
        return new Span(startOffset, endOffset,
                lineOf(startOffset), columnOf(startOffset),
                lineOf(endOffset), columnOf(endOffset));
    }
}
