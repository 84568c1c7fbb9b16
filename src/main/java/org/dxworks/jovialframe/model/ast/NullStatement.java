package org.dxworks.jovialframe.model.ast;

/**
 * A lone {@code ;}. Only kept in the tree when it carries labels.
 */
public class NullStatement extends Statement {

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
