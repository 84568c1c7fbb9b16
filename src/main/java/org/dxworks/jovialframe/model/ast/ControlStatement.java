package org.dxworks.jovialframe.model.ast;

/**
 * RETURN, EXIT, ABORT and STOP; only STOP takes a value.
 */
public class ControlStatement extends Statement {
    public String keyword;
    public Expression value;

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
