package org.dxworks.jovialframe.model.ast;

import java.util.ArrayList;
import java.util.List;

public class CallStatement extends Statement {
    public Identifier target;
    public List<Expression> inputArguments = new ArrayList<>();
    public List<Expression> outputArguments = new ArrayList<>();

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
