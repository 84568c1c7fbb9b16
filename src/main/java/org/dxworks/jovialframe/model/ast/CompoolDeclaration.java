package org.dxworks.jovialframe.model.ast;

import java.util.ArrayList;
import java.util.List;

public class CompoolDeclaration extends Declaration {
    public List<Node> members = new ArrayList<>();
    public boolean hasBlock;

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
