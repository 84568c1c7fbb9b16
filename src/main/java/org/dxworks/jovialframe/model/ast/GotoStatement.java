package org.dxworks.jovialframe.model.ast;

public class GotoStatement extends Statement {
    public Identifier target;

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
