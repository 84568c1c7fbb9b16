package org.dxworks.jovialframe.model.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code DEFINE name [(params)] [=] value;}
 */
public class ConstantDeclaration extends Declaration {
    public List<Identifier> parameters = new ArrayList<>();
    public Expression value;

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
