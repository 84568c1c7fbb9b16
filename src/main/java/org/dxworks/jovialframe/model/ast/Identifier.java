package org.dxworks.jovialframe.model.ast;

import org.dxworks.jovialframe.model.Span;

import java.util.Locale;

/**
 * A name as written in the source. Each occurrence in the tree is its own instance, so identity
 * distinguishes two uses of the same name.
 */
public final class Identifier {
    public final String text;
    public final Span span;

    public Identifier(String text, Span span) {
        this.text = text;
        this.span = span;
    }

    public String key() {
        return text.toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return text + "@" + span;
    }
}
