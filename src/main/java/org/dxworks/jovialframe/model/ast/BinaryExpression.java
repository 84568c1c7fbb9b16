package org.dxworks.jovialframe.model.ast;

public class BinaryExpression extends Expression {
    public String operator;
    public Expression left;
    public Expression right;

    @Override
    public String text() {
        return left.text() + " " + operator + " " + right.text();
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
