package org.dxworks.jovialframe.model.ast;

import org.dxworks.jovialframe.model.Span;

/**
 * One table dimension: {@code lo:hi}, {@code hi} or {@code *}.
 */
public class Dimension {
    public Expression lower;
    public Expression upper;
    public boolean star;
    public Span span;

    public String text() {
        if (star) {
            return "*";
        }
        String upperText = upper != null ? upper.text() : "?";
        return lower != null ? lower.text() + ":" + upperText : upperText;
    }
}
