package org.dxworks.jovialframe.model.ast;

import java.util.ArrayList;
import java.util.List;

public class ItemDeclaration extends Declaration {
    public TypeSpec type;
    public List<String> modifiers = new ArrayList<>();
    public Expression initializer;

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
