package org.dxworks.jovialframe.model.ast;

import org.dxworks.jovialframe.model.Span;

/**
 * Base of the syntax tree. Spans cover the node from its first to its last token.
 */
public abstract class Node {
    public Span span;

    public abstract void accept(AstVisitor visitor);
}
