package org.dxworks.jovialframe.model.ast;

import java.util.ArrayList;
import java.util.List;

public class TableDeclaration extends Declaration {
    public List<Dimension> dimensions = new ArrayList<>();
    public List<String> modifiers = new ArrayList<>();
    /** Entry type written after the dimensions, e.g. {@code TABLE T(10) U 8;}. */
    public TypeSpec entryType;
    public List<Expression> initialValues = new ArrayList<>();
    public List<Node> members = new ArrayList<>();
    public boolean hasBlock;
    /** Declared through {@code TYPE name TABLE ...}. */
    public boolean definesType;

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
