package org.dxworks.jovialframe.model.ast;

public class WhileStatement extends Statement {
    public Expression condition;
    public Node body;

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
