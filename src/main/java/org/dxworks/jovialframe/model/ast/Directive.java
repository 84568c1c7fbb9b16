package org.dxworks.jovialframe.model.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiler directive, {@code !NAME args;}. Arguments are kept as written, quotes stripped.
 */
public class Directive extends Node {
    public String name;
    public List<String> arguments = new ArrayList<>();

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
