package org.dxworks.jovialframe.model.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code PROC name [(in, ... : out, ...)] {REC|RENT|INLINE} [return type]; body}
 */
public class ProcDeclaration extends Declaration {
    public List<Identifier> inputParameters = new ArrayList<>();
    public List<Identifier> outputParameters = new ArrayList<>();
    public List<String> modifiers = new ArrayList<>();
    public TypeSpec returnType;
    public List<Node> body = new ArrayList<>();
    public boolean hasBody;

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
