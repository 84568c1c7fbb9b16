package org.dxworks.jovialframe.model.ast;

/**
 * {@code FOR v : initial [BY step | THEN next] [WHILE condition]; body}
 */
public class ForStatement extends Statement {
    public Identifier variable;
    public Expression initial;
    public Expression step;
    public Expression next;
    public Expression condition;
    public Node body;

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
