package org.dxworks.jovialframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Half-open character range [startOffset, endOffset) of a document, together with
 * the 0-based line/column of both ends.
 */
@JsonPropertyOrder({"startOffset", "endOffset", "startLine", "startColumn", "endLine", "endColumn"})
public final class Span implements Comparable<Span> {

    private final int startOffset;
    private final int endOffset;
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;

    public Span(int startOffset, int endOffset, int startLine, int startColumn, int endLine, int endColumn) {
        if (endOffset < startOffset) {
            throw new IllegalArgumentException("Span end " + endOffset + " before start " + startOffset);
        }
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    /**
     * Span running from the start of {@code first} to the end of {@code last}.
     */
    public static Span covering(Span first, Span last) {
        return new Span(first.startOffset, last.endOffset,
                first.startLine, first.startColumn, last.endLine, last.endColumn);
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    @JsonIgnore
    public Position getStart() {
        return new Position(startLine, startColumn);
    }

    @JsonIgnore
    public Position getEnd() {
        return new Position(endLine, endColumn);
    }

    public int length() {
        return endOffset - startOffset;
    }

    /**
     * True when {@code offset} lies inside the range. The end offset counts as inside so that a
     * cursor placed right after a word still hits it.
     */
    public boolean touches(int offset) {
        return offset >= startOffset && offset <= endOffset;
    }

    public boolean encloses(int offset) {
        return offset >= startOffset && offset < endOffset;
    }

    @Override
    public int compareTo(Span other) {
        int byStart = Integer.compare(startOffset, other.startOffset);
        return byStart != 0 ? byStart : Integer.compare(endOffset, other.endOffset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span)) return false;
        Span span = (Span) o;
        return startOffset == span.startOffset && endOffset == span.endOffset
                && startLine == span.startLine && startColumn == span.startColumn
                && endLine == span.endLine && endColumn == span.endColumn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startOffset, endOffset, startLine, startColumn, endLine, endColumn);
    }

    @Override
    public String toString() {
        return (startLine + 1) + ":" + (startColumn + 1) + "-" + (endLine + 1) + ":" + (endColumn + 1);
    }
}
