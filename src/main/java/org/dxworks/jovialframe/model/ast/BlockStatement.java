package org.dxworks.jovialframe.model.ast;

import java.util.ArrayList;
import java.util.List;

public class BlockStatement extends Statement {
    public List<Node> members = new ArrayList<>();

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
