package org.dxworks.jovialframe.model.ast;

public class UnaryExpression extends Expression {
    public String operator;
    public Expression operand;

    @Override
    public String text() {
        return "NOT".equals(operator) ? "NOT " + operand.text() : operator + operand.text();
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
