package org.dxworks.jovialframe.model.ast;

/**
 * {@code V(name)}
 */
public class StatusValueExpression extends Expression {
    public Identifier value;

    @Override
    public String text() {
        return "V(" + value.text + ")";
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
