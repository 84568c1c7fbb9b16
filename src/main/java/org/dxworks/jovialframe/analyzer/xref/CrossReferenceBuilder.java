package org.dxworks.jovialframe.analyzer.xref;

import org.dxworks.jovialframe.analyzer.lexer.Keywords;
import org.dxworks.jovialframe.analyzer.semantic.ScopeTree;
import org.dxworks.jovialframe.analyzer.semantic.Symbol;
import org.dxworks.jovialframe.analyzer.semantic.SymbolKind;
import org.dxworks.jovialframe.analyzer.semantic.SymbolTable;
import org.dxworks.jovialframe.model.Diagnostic;
import org.dxworks.jovialframe.model.DiagnosticCategory;
import org.dxworks.jovialframe.model.ast.AssignmentStatement;
import org.dxworks.jovialframe.model.ast.AstWalker;
import org.dxworks.jovialframe.model.ast.BinaryExpression;
import org.dxworks.jovialframe.model.ast.CallStatement;
import org.dxworks.jovialframe.model.ast.CaseBranch;
import org.dxworks.jovialframe.model.ast.CaseStatement;
import org.dxworks.jovialframe.model.ast.CompilationUnit;
import org.dxworks.jovialframe.model.ast.CompoolDeclaration;
import org.dxworks.jovialframe.model.ast.ConstantDeclaration;
import org.dxworks.jovialframe.model.ast.Declaration;
import org.dxworks.jovialframe.model.ast.Dimension;
import org.dxworks.jovialframe.model.ast.Expression;
import org.dxworks.jovialframe.model.ast.ExternalDeclaration;
import org.dxworks.jovialframe.model.ast.ForStatement;
import org.dxworks.jovialframe.model.ast.GotoStatement;
import org.dxworks.jovialframe.model.ast.Identifier;
import org.dxworks.jovialframe.model.ast.IndexedExpression;
import org.dxworks.jovialframe.model.ast.ItemDeclaration;
import org.dxworks.jovialframe.model.ast.NameExpression;
import org.dxworks.jovialframe.model.ast.ProcDeclaration;
import org.dxworks.jovialframe.model.ast.Statement;
import org.dxworks.jovialframe.model.ast.StatusDeclaration;
import org.dxworks.jovialframe.model.ast.StatusValueExpression;
import org.dxworks.jovialframe.model.ast.TableDeclaration;
import org.dxworks.jovialframe.model.ast.TypeDeclaration;
import org.dxworks.jovialframe.model.ast.TypeSpec;
import org.dxworks.jovialframe.model.ast.TypeSpecKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Second walk over the tree: records every declaring and using occurrence of a name and resolves the
 * uses against the scope tree.
 *
 * <p>Roles: assignment targets, FOR control variables and output arguments are WRITE; call statement
 * targets, and names resolving to a procedure, are CALL; everything else is READ. A {@code V(name)}
 * prefers the values of the enumeration implied by its context: the assignment target, the other
 * side of a comparison, the CASE selector or the declared item.</p>
 */
public final class CrossReferenceBuilder extends AstWalker {

    private static final Set<String> RELATIONAL_OPERATORS = Set.of("=", "<>", "<", ">", "<=", ">=");

    private final SymbolTable table;
    private final ScopeTree tree;
    private final boolean reportUnresolved;
    private final List<Occurrence> occurrences = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Deque<Symbol> expectedValueSets = new ArrayDeque<>();
    private final Set<String> defineParameters = new HashSet<>();
    private int currentScope;

    private CrossReferenceBuilder(SymbolTable table, boolean reportUnresolved) {
        this.table = table;
        this.tree = table.getScopeTree();
        this.reportUnresolved = reportUnresolved;
        this.currentScope = tree.getRoot().getIndex();
    }

    public static CrossReferenceIndex build(CompilationUnit unit, SymbolTable table, boolean reportUnresolved) {
        CrossReferenceBuilder builder = new CrossReferenceBuilder(table, reportUnresolved);
        unit.accept(builder);
        return new CrossReferenceIndex(builder.occurrences, builder.diagnostics);
    }

    // ------------------------------------------------------------------ declarations

    @Override
    public void visit(ConstantDeclaration declaration) {
        declaration(declaration.name);
        declaration.parameters.forEach(parameter -> defineParameters.add(parameter.key()));
        try {
            visitNullable(declaration.value);
        } finally {
            defineParameters.clear();
        }
    }

    @Override
    public void visit(ItemDeclaration declaration) {
        declaration(declaration.name);
        typeReferences(declaration.type);
        withValueSet(valueSetOf(table.declaredBy(declaration.name)), () -> visitNullable(declaration.initializer));
    }

    @Override
    public void visit(StatusDeclaration declaration) {
        declaration(declaration.name);
        typeReferences(declaration.type);
        withValueSet(valueSetOf(table.declaredBy(declaration.name)), () -> visitNullable(declaration.initializer));
    }

    @Override
    public void visit(TableDeclaration declaration) {
        declaration(declaration.name);
        for (Dimension dimension : declaration.dimensions) {
            visitNullable(dimension.lower);
            visitNullable(dimension.upper);
        }
        typeReferences(declaration.entryType);
        withValueSet(valueSetOf(table.declaredBy(declaration.name)), () -> visitAll(declaration.initialValues));
        inScope(declaration, () -> visitAll(declaration.members));
    }

    @Override
    public void visit(ProcDeclaration declaration) {
        declaration(declaration.name);
        inScope(declaration, () -> {
            List<Identifier> header = new ArrayList<>(declaration.inputParameters);
            header.addAll(declaration.outputParameters);
            for (Identifier parameter : header) {
                if (table.declaredBy(parameter) != null) {
                    declaration(parameter);
                } else {
                    reference(parameter, OccurrenceRole.READ);
                }
            }
            typeReferences(declaration.returnType);
            visitAll(declaration.body);
        });
    }

    @Override
    public void visit(CompoolDeclaration declaration) {
        declaration(declaration.name);
        inScope(declaration, () -> visitAll(declaration.members));
    }

    @Override
    public void visit(TypeDeclaration declaration) {
        declaration(declaration.name);
        typeReferences(declaration.type);
    }

    @Override
    public void visit(ExternalDeclaration declaration) {
        declaration(declaration.name);
    }

    // ------------------------------------------------------------------ statements

    @Override
    protected void enterStatement(Statement statement) {
        statement.labels.forEach(this::declaration);
    }

    @Override
    public void visit(AssignmentStatement statement) {
        enterStatement(statement);
        Symbol expected = null;
        for (Expression target : statement.targets) {
            Symbol written = writeTarget(target);
            if (expected == null) {
                expected = valueSetOf(written);
            }
        }
        withValueSet(expected, () -> visitNullable(statement.value));
    }

    @Override
    public void visit(CallStatement statement) {
        enterStatement(statement);
        reference(statement.target, OccurrenceRole.CALL);
        visitAll(statement.inputArguments);
        for (Expression output : statement.outputArguments) {
            writeTarget(output);
        }
    }

    @Override
    public void visit(ForStatement statement) {
        enterStatement(statement);
        if (statement.variable != null) {
            if (table.declaredBy(statement.variable) != null) {
                declaration(statement.variable);
            } else {
                reference(statement.variable, OccurrenceRole.WRITE);
            }
        }
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
        Symbol selectorSet = valueSetOf(resolveQuietly(statement.selector));
        for (CaseBranch branch : statement.branches) {
            withValueSet(selectorSet, () -> visitAll(branch.labels));
            visitNullable(branch.body);
        }
    }

    @Override
    public void visit(GotoStatement statement) {
        enterStatement(statement);
        if (statement.target != null) {
            reference(statement.target, OccurrenceRole.READ);
        }
    }

    // ------------------------------------------------------------------ expressions

    @Override
    public void visit(NameExpression expression) {
        Identifier name = expression.name;
        if (defineParameters.contains(name.key())) {
            return;
        }
        if (Keywords.isBuiltinFunction(name.text) && tree.resolve(currentScope, name.key()).isEmpty()) {
            return;
        }
        reference(name, OccurrenceRole.READ);
    }

    @Override
    public void visit(IndexedExpression expression) {
        if (!expression.builtin && !defineParameters.contains(expression.name.key())) {
            reference(expression.name, OccurrenceRole.READ);
        }
        visitAll(expression.arguments);
    }

    @Override
    public void visit(StatusValueExpression expression) {
        Identifier value = expression.value;
        Symbol symbol = tree.resolveStatusValue(currentScope, value.key(), expectedValueSets.peek()).orElse(null);
        occurrences.add(new Occurrence(value.span, symbol, OccurrenceRole.READ, value.text, currentScope));
        if (symbol == null && reportUnresolved) {
            diagnostics.add(Diagnostic.warning(value.span, "unresolved status value V(" + value.text + ")",
                    DiagnosticCategory.UNRESOLVED_REFERENCE));
        }
    }

    @Override
    public void visit(BinaryExpression expression) {
        if (!RELATIONAL_OPERATORS.contains(expression.operator)) {
            super.visit(expression);
            return;
        }
        Symbol leftSet = valueSetOf(resolveQuietly(expression.left));
        Symbol rightSet = valueSetOf(resolveQuietly(expression.right));
        withValueSet(rightSet, () -> visitNullable(expression.left));
        withValueSet(leftSet, () -> visitNullable(expression.right));
    }

    // ------------------------------------------------------------------ helpers

    private void declaration(Identifier name) {
        Symbol symbol = table.declaredBy(name);
        if (symbol == null) {
            return;
        }
        OccurrenceRole role = table.isRedeclaration(name) ? OccurrenceRole.REDECLARATION : OccurrenceRole.DECLARATION;
        occurrences.add(new Occurrence(name.span, symbol, role, name.text, symbol.getScopeIndex()));
    }

    private Symbol reference(Identifier name, OccurrenceRole role) {
        Symbol symbol = tree.resolve(currentScope, name.key()).orElse(null);
        if (symbol == null) {
            occurrences.add(new Occurrence(name.span, null, role, name.text, currentScope));
            if (reportUnresolved) {
                diagnostics.add(Diagnostic.warning(name.span, "unresolved reference to " + name.text,
                        DiagnosticCategory.UNRESOLVED_REFERENCE));
            }
            return null;
        }
        OccurrenceRole actual = role == OccurrenceRole.READ && symbol.getKind() == SymbolKind.PROCEDURE
                ? OccurrenceRole.CALL
                : role;
        occurrences.add(new Occurrence(name.span, symbol, actual, name.text, currentScope));
        return symbol;
    }

    /**
     * Records an assignment target as written and returns the symbol it resolved to.
     */
    private Symbol writeTarget(Expression target) {
        if (target instanceof NameExpression name) {
            return reference(name.name, OccurrenceRole.WRITE);
        }
        if (target instanceof IndexedExpression indexed) {
            Symbol symbol = indexed.builtin ? null : reference(indexed.name, OccurrenceRole.WRITE);
            visitAll(indexed.arguments);
            return symbol;
        }
        if (target instanceof BinaryExpression qualified && "@".equals(qualified.operator)) {
            Symbol symbol = writeTarget(qualified.left);
            visitNullable(qualified.right);
            return symbol;
        }
        visitNullable(target);
        return null;
    }

    private void typeReferences(TypeSpec type) {
        if (type == null) {
            return;
        }
        if (type.typeName != null) {
            reference(type.typeName, OccurrenceRole.READ);
        }
        if (type.kind == TypeSpecKind.STATUS) {
            type.statusValues.forEach(this::declaration);
        }
    }

    private void inScope(Declaration declaration, Runnable body) {
        int scope = table.scopeOf(declaration);
        if (scope < 0) {
            body.run();
            return;
        }
        int saved = currentScope;
        currentScope = scope;
        try {
            body.run();
        } finally {
            currentScope = saved;
        }
    }

    private void withValueSet(Symbol valueSet, Runnable body) {
        if (valueSet == null) {
            body.run();
            return;
        }
        expectedValueSets.push(valueSet);
        try {
            body.run();
        } finally {
            expectedValueSets.pop();
        }
    }

    /**
     * Symbol an expression names, looked up without recording an occurrence.
     */
    private Symbol resolveQuietly(Expression expression) {
        if (expression instanceof NameExpression name) {
            return tree.resolve(currentScope, name.name.key()).orElse(null);
        }
        if (expression instanceof IndexedExpression indexed && !indexed.builtin) {
            return tree.resolve(currentScope, indexed.name.key()).orElse(null);
        }
        if (expression instanceof StatusValueExpression status) {
            Symbol value = tree.resolveStatusValue(currentScope, status.value.key(), null).orElse(null);
            return value != null ? value.getOwner() : null;
        }
        return null;
    }

    private static Symbol valueSetOf(Symbol symbol) {
        return symbol != null ? symbol.getValueSet() : null;
    }
}
