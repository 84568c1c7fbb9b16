package org.dxworks.jovialframe.model.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An item whose type is a status list: {@code ITEM MODE STATUS (V(ON), V(OFF));}
 */
public class StatusDeclaration extends Declaration {
    /** Always of kind {@link TypeSpecKind#STATUS}; holds the value names. */
    public TypeSpec type;
    public List<String> modifiers = new ArrayList<>();
    public Expression initializer;

    public List<Identifier> values() {
        return type.statusValues;
    }

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
