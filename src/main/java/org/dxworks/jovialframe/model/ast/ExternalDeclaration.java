package org.dxworks.jovialframe.model.ast;

/**
 * Bare {@code DEF name;} or {@code REF name;}.
 */
public class ExternalDeclaration extends Declaration {

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
