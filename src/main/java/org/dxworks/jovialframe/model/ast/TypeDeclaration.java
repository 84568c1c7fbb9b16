package org.dxworks.jovialframe.model.ast;

/**
 * {@code TYPE name type;} for scalar and status types; table types are {@link TableDeclaration}s
 * with {@code definesType} set.
 */
public class TypeDeclaration extends Declaration {
    public TypeSpec type;

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
