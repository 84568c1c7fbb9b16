package org.dxworks.jovialframe.model.ast;

/**
 * Visitor over the syntax tree; {@link AstWalker} provides the default traversal.
 */
public interface AstVisitor {

    void visit(CompilationUnit unit);

    void visit(ConstantDeclaration declaration);

    void visit(ItemDeclaration declaration);

    void visit(StatusDeclaration declaration);

    void visit(TableDeclaration declaration);

    void visit(ProcDeclaration declaration);

    void visit(CompoolDeclaration declaration);

    void visit(TypeDeclaration declaration);

    void visit(ExternalDeclaration declaration);

    void visit(Directive directive);

    void visit(AssignmentStatement statement);

    void visit(CallStatement statement);

    void visit(IfStatement statement);

    void visit(WhileStatement statement);

    void visit(ForStatement statement);

    void visit(CaseStatement statement);

    void visit(GotoStatement statement);

    void visit(ControlStatement statement);

    void visit(BlockStatement statement);

    void visit(NullStatement statement);

    void visit(NameExpression expression);

    void visit(IndexedExpression expression);

    void visit(StatusValueExpression expression);

    void visit(LiteralExpression expression);

    void visit(BinaryExpression expression);

    void visit(UnaryExpression expression);
}
