package org.dxworks.jovialframe.model.ast;

public class IfStatement extends Statement {
    public Expression condition;
    public Node thenBranch;
    public Node elseBranch;

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
