package org.dxworks.jovialframe.model.ast;

public class NameExpression extends Expression {
    public Identifier name;

    public NameExpression(Identifier name) {
        this.name = name;
        this.span = name.span;
    }

    @Override
    public String text() {
        return name.text;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
