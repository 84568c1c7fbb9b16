package org.dxworks.jovialframe.model.ast;

import java.util.List;

/**
 * Visits every node of a tree in source order. Subclasses override the nodes they care about and
 * call the matching {@code super.visit} to keep descending.
 */
public abstract class AstWalker implements AstVisitor {

    @Override
    public void visit(CompilationUnit unit) {
        visitAll(unit.members);
    }

    @Override
    public void visit(ConstantDeclaration declaration) {
        visitNullable(declaration.value);
    }

    @Override
    public void visit(ItemDeclaration declaration) {
        visitNullable(declaration.initializer);
    }

    @Override
    public void visit(StatusDeclaration declaration) {
        visitNullable(declaration.initializer);
    }

    @Override
    public void visit(TableDeclaration declaration) {
        for (Dimension dimension : declaration.dimensions) {
            visitNullable(dimension.lower);
            visitNullable(dimension.upper);
        }
        visitAll(declaration.initialValues);
        visitAll(declaration.members);
    }

    @Override
    public void visit(ProcDeclaration declaration) {
        visitAll(declaration.body);
    }

    @Override
    public void visit(CompoolDeclaration declaration) {
        visitAll(declaration.members);
    }

    @Override
    public void visit(TypeDeclaration declaration) {
    }

    @Override
    public void visit(ExternalDeclaration declaration) {
    }

    @Override
    public void visit(Directive directive) {
    }

    @Override
    public void visit(AssignmentStatement statement) {
        enterStatement(statement);
        visitAll(statement.targets);
        visitNullable(statement.value);
    }

    @Override
    public void visit(CallStatement statement) {
        enterStatement(statement);
        visitAll(statement.inputArguments);
        visitAll(statement.outputArguments);
    }

    @Override
    public void visit(IfStatement statement) {
        enterStatement(statement);
        visitNullable(statement.condition);
        visitNullable(statement.thenBranch);
        visitNullable(statement.elseBranch);
    }

    @Override
    public void visit(WhileStatement statement) {
        enterStatement(statement);
        visitNullable(statement.condition);
        visitNullable(statement.body);
    }

    @Override
    public void visit(ForStatement statement) {
        enterStatement(statement);
        visitNullable(statement.initial);
        visitNullable(statement.step);
        visitNullable(statement.next);
        visitNullable(statement.condition);
        visitNullable(statement.body);
    }

    @Override
    public void visit(CaseStatement statement) {
        enterStatement(statement);
        visitNullable(statement.selector);
        for (CaseBranch branch : statement.branches) {
            visitAll(branch.labels);
            visitNullable(branch.body);
        }
    }

    @Override
    public void visit(GotoStatement statement) {
        enterStatement(statement);
    }

    @Override
    public void visit(ControlStatement statement) {
        enterStatement(statement);
        visitNullable(statement.value);
    }

    @Override
    public void visit(BlockStatement statement) {
        enterStatement(statement);
        visitAll(statement.members);
    }

    @Override
    public void visit(NullStatement statement) {
        enterStatement(statement);
    }

    @Override
    public void visit(NameExpression expression) {
    }

    @Override
    public void visit(IndexedExpression expression) {
        visitAll(expression.arguments);
    }

    @Override
    public void visit(StatusValueExpression expression) {
    }

    @Override
    public void visit(LiteralExpression expression) {
    }

    @Override
    public void visit(BinaryExpression expression) {
        visitNullable(expression.left);
        visitNullable(expression.right);
    }

    @Override
    public void visit(UnaryExpression expression) {
        visitNullable(expression.operand);
    }

    /**
     * Called first by every statement visit; labels are handled here.
     */
    protected void enterStatement(Statement statement) {
    }

    protected void visitAll(List<? extends Node> nodes) {
        for (Node node : nodes) {
            node.accept(this);
        }
    }

    protected void visitNullable(Node node) {
        if (node != null) {
            node.accept(this);
        }
    }
}
