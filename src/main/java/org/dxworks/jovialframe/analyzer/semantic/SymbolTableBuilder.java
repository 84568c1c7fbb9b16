package org.dxworks.jovialframe.analyzer.semantic;

import org.dxworks.jovialframe.model.Diagnostic;
import org.dxworks.jovialframe.model.DiagnosticCategory;
import org.dxworks.jovialframe.model.Span;
import org.dxworks.jovialframe.model.ast.AstWalker;
import org.dxworks.jovialframe.model.ast.CompilationUnit;
import org.dxworks.jovialframe.model.ast.CompoolDeclaration;
import org.dxworks.jovialframe.model.ast.ConstantDeclaration;
import org.dxworks.jovialframe.model.ast.Declaration;
import org.dxworks.jovialframe.model.ast.Dimension;
import org.dxworks.jovialframe.model.ast.Expression;
import org.dxworks.jovialframe.model.ast.ExternalDeclaration;
import org.dxworks.jovialframe.model.ast.ForStatement;
import org.dxworks.jovialframe.model.ast.Identifier;
import org.dxworks.jovialframe.model.ast.ItemDeclaration;
import org.dxworks.jovialframe.model.ast.Linkage;
import org.dxworks.jovialframe.model.ast.LiteralExpression;
import org.dxworks.jovialframe.model.ast.LiteralKind;
import org.dxworks.jovialframe.model.ast.Node;
import org.dxworks.jovialframe.model.ast.ProcDeclaration;
import org.dxworks.jovialframe.model.ast.Statement;
import org.dxworks.jovialframe.model.ast.StatusDeclaration;
import org.dxworks.jovialframe.model.ast.StatusValueExpression;
import org.dxworks.jovialframe.model.ast.TableDeclaration;
import org.dxworks.jovialframe.model.ast.TypeDeclaration;
import org.dxworks.jovialframe.model.ast.TypeSpec;
import org.dxworks.jovialframe.model.ast.TypeSpecKind;
import org.dxworks.jovialframe.model.ast.UnaryExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the scope tree of a compilation unit in one walk.
 *
 * <p>Symbols go into the innermost scope in declaration order. A name declared twice in the same
 * scope is reported once, on the second name, and the first declaration stays bound. Implicit loop
 * variables are added after the walk, once every explicit declaration is known.</p>
 */
public final class SymbolTableBuilder extends AstWalker {

    private static final String MAIN_PROGRAM = "MAIN";

    private static final class PendingLoop {
        private final ForStatement statement;
        private final int scopeIndex;

        private PendingLoop(ForStatement statement, int scopeIndex) {
            this.statement = statement;
            this.scopeIndex = scopeIndex;
        }
    }

    private final ScopeTree tree = new ScopeTree();
    private final Map<Identifier, Symbol> declared = new IdentityHashMap<>();
    private final Set<Identifier> redeclared = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Map<Declaration, Integer> ownedScopes = new IdentityHashMap<>();
    private final Map<Integer, Map<String, String>> parameterModes = new HashMap<>();
    private final List<PendingLoop> loops = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int currentScope;

    private SymbolTableBuilder() {
    }

    public static SymbolTable build(CompilationUnit unit) {
        SymbolTableBuilder builder = new SymbolTableBuilder();
        String rootName = unit.programName != null ? unit.programName.text : MAIN_PROGRAM;
        builder.currentScope = builder.tree.addScope(ScopeKind.PROGRAM, rootName, -1, unit.span).getIndex();
        unit.accept(builder);
        builder.declareLoopVariables();
        builder.tree.verify();
        return new SymbolTable(builder.tree, builder.declared, builder.redeclared, builder.ownedScopes, builder.diagnostics);
    }

    // ------------------------------------------------------------------ declarations

    @Override
    public void visit(ConstantDeclaration declaration) {
        Symbol symbol = declare(declaration, SymbolKind.CONSTANT, null);
        if (symbol != null) {
            symbol.putDetail("value", declaration.value != null ? declaration.value.text() : null);
            symbol.putDetail("parameters", declaration.parameters.isEmpty() ? null : "(" + names(declaration.parameters) + ")");
            symbol.putDetail("linkage", linkage(declaration));
        }
    }

    @Override
    public void visit(ItemDeclaration declaration) {
        String mode = parameterMode(declaration.name);
        checkType(declaration.type, declaration.initializer);
        Symbol symbol = declare(declaration, mode != null ? SymbolKind.PARAMETER : SymbolKind.ITEM,
                declaration.type != null ? declaration.type.text() : null);
        if (symbol == null) {
            return;
        }
        describeItem(symbol, mode, declaration.modifiers, declaration.initializer, declaration);
        if (declaration.type != null && declaration.type.kind == TypeSpecKind.NAMED) {
            tree.resolve(currentScope, declaration.type.typeName.key())
                    .filter(type -> !type.getMembers().isEmpty())
                    .ifPresent(symbol::setValueSet);
        }
    }

    @Override
    public void visit(StatusDeclaration declaration) {
        String mode = parameterMode(declaration.name);
        if (declaration.initializer instanceof LiteralExpression) {
            warn(declaration.initializer.span, "initial value " + declaration.initializer.text()
                    + " of status item " + declaration.name.text + " is not a status value");
        }
        Symbol symbol = declare(declaration, mode != null ? SymbolKind.PARAMETER : SymbolKind.STATUS,
                declaration.type.text());
        if (symbol == null) {
            return;
        }
        describeItem(symbol, mode, declaration.modifiers, declaration.initializer, declaration);
        symbol.setValueSet(symbol);
        declareStatusValues(symbol, declaration.values(), declaration);
    }

    @Override
    public void visit(TableDeclaration declaration) {
        String mode = parameterMode(declaration.name);
        SymbolKind kind = declaration.definesType ? SymbolKind.TYPE
                : mode != null ? SymbolKind.PARAMETER : SymbolKind.TABLE;
        checkType(declaration.entryType, null);

        Symbol symbol = declare(declaration, kind, tableType(declaration));
        if (symbol != null) {
            symbol.putDetail("dimensions", dimensions(declaration));
            symbol.putDetail("modifiers", String.join(" ", declaration.modifiers));
            symbol.putDetail("linkage", linkage(declaration));
            symbol.putDetail("mode", mode);
            if (declaration.entryType != null && declaration.entryType.kind == TypeSpecKind.STATUS) {
                symbol.setValueSet(symbol);
                declareStatusValues(symbol, declaration.entryType.statusValues, declaration);
            }
        }
        enterScope(declaration, symbol, ScopeKind.TABLE_BLOCK, () -> visitAll(declaration.members));
    }

    @Override
    public void visit(ProcDeclaration declaration) {
        Symbol symbol = declare(declaration, SymbolKind.PROCEDURE,
                declaration.returnType != null ? declaration.returnType.text() : null);
        if (symbol != null) {
            symbol.putDetail("parameters", parameterList(declaration));
            symbol.putDetail("modifiers", String.join(" ", declaration.modifiers));
            symbol.putDetail("linkage", linkage(declaration));
        }
        enterScope(declaration, symbol, ScopeKind.PROCEDURE, () -> {
            declareParameters(declaration, symbol);
            visitAll(declaration.body);
        });
    }

    @Override
    public void visit(CompoolDeclaration declaration) {
        Symbol symbol = declare(declaration, SymbolKind.COMPOOL, null);
        if (symbol != null) {
            symbol.putDetail("linkage", linkage(declaration));
        }
        enterScope(declaration, symbol, ScopeKind.COMPOOL, () -> visitAll(declaration.members));
    }

    @Override
    public void visit(TypeDeclaration declaration) {
        checkType(declaration.type, null);
        Symbol symbol = declare(declaration, SymbolKind.TYPE, declaration.type != null ? declaration.type.text() : null);
        if (symbol == null) {
            return;
        }
        symbol.putDetail("linkage", linkage(declaration));
        if (declaration.type != null && declaration.type.kind == TypeSpecKind.STATUS) {
            symbol.setValueSet(symbol);
            declareStatusValues(symbol, declaration.type.statusValues, declaration);
        }
    }

    @Override
    public void visit(ExternalDeclaration declaration) {
        Symbol symbol = declare(declaration, SymbolKind.EXTERNAL, null);
        if (symbol != null) {
            symbol.putDetail("linkage", linkage(declaration));
        }
    }

    // ------------------------------------------------------------------ statements

    @Override
    protected void enterStatement(Statement statement) {
        for (Identifier label : statement.labels) {
            bind(newSymbol(label, SymbolKind.LABEL, null, label.span, null, null), label);
        }
    }

    @Override
    public void visit(ForStatement statement) {
        loops.add(new PendingLoop(statement, currentScope));
        super.visit(statement);
    }

    /**
     * A single-letter FOR variable that is not declared anywhere becomes a loop variable of its scope.
     */
    private void declareLoopVariables() {
        for (PendingLoop loop : loops) {
            Identifier variable = loop.statement.variable;
            if (variable == null || variable.text.length() != 1
                    || tree.resolve(loop.scopeIndex, variable.key()).isPresent()) {
                continue;
            }
            int saved = currentScope;
            currentScope = loop.scopeIndex;
            bind(newSymbol(variable, SymbolKind.LOOP_VARIABLE, null, variable.span, null, null), variable);
            currentScope = saved;
        }
    }

    // ------------------------------------------------------------------ scopes and binding

    private void enterScope(Declaration declaration, Symbol owner, ScopeKind kind, Runnable body) {
        Scope scope = tree.addScope(kind, declaration.name.text, currentScope, declaration.span);
        ownedScopes.put(declaration, scope.getIndex());
        if (owner != null) {
            owner.setOwnedScopeIndex(scope.getIndex());
            scope.setOwner(owner);
        }
        int saved = currentScope;
        currentScope = scope.getIndex();
        try {
            body.run();
        } finally {
            currentScope = saved;
        }
    }

    /**
     * Header parameters of a procedure. A parameter the body declares is bound by that declaration;
     * the others get an implicit symbol at the header name.
     */
    private void declareParameters(ProcDeclaration declaration, Symbol procedure) {
        Set<String> declaredInBody = new HashSet<>();
        for (Node member : declaration.body) {
            if (member instanceof Declaration bodyDeclaration && bodyDeclaration.name != null) {
                declaredInBody.add(bodyDeclaration.name.key());
            }
        }

        Map<String, String> modes = new LinkedHashMap<>();
        for (Identifier input : declaration.inputParameters) {
            modes.putIfAbsent(input.key(), "input");
        }
        for (Identifier output : declaration.outputParameters) {
            modes.putIfAbsent(output.key(), "output");
        }
        parameterModes.put(currentScope, modes);

        List<Identifier> header = new ArrayList<>(declaration.inputParameters);
        header.addAll(declaration.outputParameters);
        for (Identifier parameter : header) {
            if (declaredInBody.contains(parameter.key())) {
                continue;
            }
            Symbol symbol = newSymbol(parameter, SymbolKind.PARAMETER, null, parameter.span, null, null);
            symbol.putDetail("mode", modes.get(parameter.key()));
            symbol.setOwner(procedure);
            bind(symbol, parameter);
        }
    }

    private String parameterMode(Identifier name) {
        Map<String, String> modes = parameterModes.get(currentScope);
        return modes != null && name != null ? modes.get(name.key()) : null;
    }

    private Symbol declare(Declaration declaration, SymbolKind kind, String type) {
        Symbol symbol = newSymbol(declaration.name, kind, type, declaration.span, declaration.documentation, declaration);
        return bind(symbol, declaration.name);
    }

    private Symbol newSymbol(Identifier name, SymbolKind kind, String type, Span extent,
                             String documentation, Declaration declaration) {
        return new Symbol(tree.nextSymbolId(), name.text, kind, type, currentScope,
                name.span, extent != null ? extent : name.span, documentation, declaration);
    }

    /**
     * Binds {@code symbol} in the current scope. Returns null when the name was already taken there.
     */
    private Symbol bind(Symbol symbol, Identifier name) {
        Symbol existing = tree.get(currentScope).bind(symbol);
        if (existing != null) {
            reportDuplicate(name, existing);
            return null;
        }
        tree.register(symbol);
        declared.put(name, symbol);
        return symbol;
    }

    /**
     * Status values are bound in the current scope like any other name, so a value repeated in one
     * enumeration or already taken in the scope is a duplicate.
     */
    private void declareStatusValues(Symbol valueSet, List<Identifier> values, Declaration declaration) {
        for (Identifier value : values) {
            Symbol member = newSymbol(value, SymbolKind.STATUS_VALUE, valueSet.getName(), value.span, null, declaration);
            member.setOwner(valueSet);
            member.setValueSet(valueSet);
            if (bind(member, value) != null) {
                valueSet.addMember(member);
            }
        }
    }

    private void reportDuplicate(Identifier name, Symbol existing) {
        declared.put(name, existing);
        redeclared.add(name);
        diagnostics.add(Diagnostic.warning(name.span,
                "duplicate declaration of " + name.text + " (first declared at line "
                        + (existing.getDeclarationSpan().getStartLine() + 1) + ")",
                DiagnosticCategory.DUPLICATE_DECLARATION));
    }

    // ------------------------------------------------------------------ type consistency

    private void checkType(TypeSpec type, Expression initializer) {
        if (type == null || type.kind != TypeSpecKind.SCALAR) {
            return;
        }
        String letter = type.letter;
        if (type.width != null && type.width <= 0) {
            warn(type.span, "width of " + type.text() + " must be positive");
        }
        if (type.scale != null && !"A".equals(letter)) {
            warn(type.span, "scale is only allowed on fixed types, not " + type.text());
        }
        if ("A".equals(letter) && type.width == null) {
            warn(type.span, "fixed type A needs a width");
        }
        if ("P".equals(letter) && type.width != null) {
            warn(type.span, "pointer type takes no width: " + type.text());
        }
        if (initializer == null) {
            return;
        }
        if (initializer instanceof StatusValueExpression) {
            warn(initializer.span, "status value " + initializer.text() + " used to initialize an item of type " + type.text());
            return;
        }
        LiteralKind literalKind = literalKind(initializer);
        if (literalKind != null && !accepts(letter, literalKind)) {
            warn(initializer.span, "initial value " + initializer.text() + " does not match type " + type.text());
        }
    }

    private static LiteralKind literalKind(Expression expression) {
        if (expression instanceof LiteralExpression literal) {
            return literal.kind;
        }
        if (expression instanceof UnaryExpression unary && !"NOT".equals(unary.operator)
                && unary.operand instanceof LiteralExpression literal && literal.kind != LiteralKind.STRING) {
            return literal.kind;
        }
        return null;
    }

    private static boolean accepts(String letter, LiteralKind kind) {
        return switch (letter) {
            case "C" -> kind == LiteralKind.STRING;
            case "S", "U", "F", "A" -> kind == LiteralKind.INTEGER || kind == LiteralKind.FLOAT || kind == LiteralKind.FIXED;
            case "B" -> kind == LiteralKind.BIT_STRING;
            default -> true;
        };
    }

    private void warn(Span span, String message) {
        diagnostics.add(Diagnostic.warning(span, message, DiagnosticCategory.TYPE_CONSISTENCY));
    }

    // ------------------------------------------------------------------ details

    private void describeItem(Symbol symbol, String mode, List<String> modifiers, Expression initializer,
                              Declaration declaration) {
        symbol.putDetail("mode", mode);
        symbol.putDetail("modifiers", String.join(" ", modifiers));
        symbol.putDetail("initial value", initializer != null ? initializer.text() : null);
        symbol.putDetail("linkage", linkage(declaration));
        if (mode != null) {
            symbol.setOwner(tree.get(currentScope).getOwner());
        }
    }

    private static String linkage(Declaration declaration) {
        return declaration.linkage == Linkage.NONE ? null : declaration.linkage.name();
    }

    private static String tableType(TableDeclaration declaration) {
        StringBuilder sb = new StringBuilder("TABLE");
        String dimensions = dimensions(declaration);
        if (dimensions != null) {
            sb.append(' ').append(dimensions);
        }
        if (declaration.entryType != null) {
            sb.append(' ').append(declaration.entryType.text());
        }
        return sb.toString();
    }

    private static String dimensions(TableDeclaration declaration) {
        if (declaration.dimensions.isEmpty()) {
            return null;
        }
        return declaration.dimensions.stream().map(Dimension::text).collect(Collectors.joining(", ", "(", ")"));
    }

    private static String parameterList(ProcDeclaration declaration) {
        if (declaration.inputParameters.isEmpty() && declaration.outputParameters.isEmpty()) {
            return null;
        }
        String inputs = names(declaration.inputParameters);
        return declaration.outputParameters.isEmpty()
                ? "(" + inputs + ")"
                : "(" + inputs + " : " + names(declaration.outputParameters) + ")";
    }

    private static String names(List<Identifier> identifiers) {
        return identifiers.stream().map(identifier -> identifier.text).collect(Collectors.joining(", "));
    }
}
