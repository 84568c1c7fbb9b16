package org.dxworks.jovialframe.model.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code name(args)}: a table subscript, a function call or a built-in function.
 */
public class IndexedExpression extends Expression {
    public Identifier name;
    public List<Expression> arguments = new ArrayList<>();
    public boolean builtin;

    @Override
    public String text() {
        return name.text + "(" + arguments.stream().map(Expression::text).collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
