package org.dxworks.jovialframe.model.ast;

public class LiteralExpression extends Expression {
    public LiteralKind kind;
    public String value;

    @Override
    public String text() {
        return value;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
