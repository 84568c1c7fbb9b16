package org.dxworks.jovialframe.model.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code t {, t} := e;} ({@code =} is accepted as well).
 */
public class AssignmentStatement extends Statement {
    public List<Expression> targets = new ArrayList<>();
    public Expression value;

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
