package org.dxworks.jovialframe.analyzer.parser;

import org.dxworks.jovialframe.model.Span;

/**
 * Unwinds the parser to the nearest recovery point. Never escapes {@link JovialParser}.
 */
final class SyntaxError extends RuntimeException {

    private final transient Span span;

    SyntaxError(String message, Span span) {
        super(message, null, false, false);
        this.span = span;
    }

    Span getSpan() {
        return span;
    }
}
