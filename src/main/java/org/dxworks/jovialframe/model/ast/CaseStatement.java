package org.dxworks.jovialframe.model.ast;

import java.util.ArrayList;
import java.util.List;

public class CaseStatement extends Statement {
    public Expression selector;
    public List<CaseBranch> branches = new ArrayList<>();

    @Override
    public void accept(AstVisitor visitor) {
        visitor.visit(this);
    }
}
