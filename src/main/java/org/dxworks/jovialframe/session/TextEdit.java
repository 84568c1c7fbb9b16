package org.dxworks.jovialframe.session;

import org.dxworks.jovialframe.analyzer.lexer.LineIndex;
import org.dxworks.jovialframe.model.Position;

import java.util.List;

/**
 * A change to a document's text: the range [start, end) replaced by {@code newText}, or the whole
 * text when the range is missing.
 */
public final class TextEdit {

    private final Position start;
    private final Position end;
    private final String newText;

    private TextEdit(Position start, Position end, String newText) {
        this.start = start;
        this.end = end;
        this.newText = newText == null ? "" : newText;
    }

    public static TextEdit replace(Position start, Position end, String newText) {
        return new TextEdit(start, end, newText);
    }

    public static TextEdit insert(Position at, String newText) {
        return new TextEdit(at, at, newText);
    }

    public static TextEdit delete(Position start, Position end) {
        return new TextEdit(start, end, "");
    }

    public static TextEdit fullText(String text) {
        return new TextEdit(null, null, text);
    }

    public Position getStart() {
        return start;
    }

    public Position getEnd() {
        return end;
    }

    public String getNewText() {
        return newText;
    }

    public boolean isFullText() {
        return start == null || end == null;
    }

    /**
     * Applies this edit. Positions past the end of a line or of the text are clamped.
     */
    public String applyTo(String text) {
        if (isFullText()) {
            return newText;
        }
        LineIndex lineIndex = new LineIndex(text);
        int from = lineIndex.offsetOf(start);
        int to = Math.max(from, lineIndex.offsetOf(end));
        return text.substring(0, from) + newText + text.substring(to);
    }

    /**
     * Applies {@code edits} one after the other; each edit's positions refer to the text left by the previous one.
     */
    public static String applyAll(String text, List<TextEdit> edits) {
        String result = text;
        for (TextEdit edit : edits) {
            result = edit.applyTo(result);
        }
        return result;
    }

    @Override
    public String toString() {
        return isFullText() ? "full text" : start + "-" + end + " -> \"" + newText + "\"";
    }
}
