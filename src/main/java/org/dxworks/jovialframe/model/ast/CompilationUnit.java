package org.dxworks.jovialframe.model.ast;

import java.util.ArrayList;
import java.util.List;

public class CompilationUnit extends Node {
    public ModuleKind moduleKind = ModuleKind.PROGRAM;
    /** Name from {@code START [PROGRAM|COMPOOL] name;}, null when the header is missing. */
    public Identifier programName;
    public List<Node> members = new ArrayList<>();
    public List<Directive> directives = new ArrayList<>();
    public boolean terminated;

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
