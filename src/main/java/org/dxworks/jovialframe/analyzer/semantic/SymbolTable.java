package org.dxworks.jovialframe.analyzer.semantic;

import org.dxworks.jovialframe.model.Diagnostic;
import org.dxworks.jovialframe.model.ast.Declaration;
import org.dxworks.jovialframe.model.ast.Identifier;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scope tree of one document plus the bindings from declaring identifiers to their symbols.
 */
public final class SymbolTable {

    private final ScopeTree scopeTree;
    private final Map<Identifier, Symbol> declared;
    private final Set<Identifier> redeclared;
    private final Map<Declaration, Integer> ownedScopes;
    private final List<Diagnostic> diagnostics;

    SymbolTable(ScopeTree scopeTree, Map<Identifier, Symbol> declared, Set<Identifier> redeclared,
                Map<Declaration, Integer> ownedScopes, List<Diagnostic> diagnostics) {
        this.scopeTree = scopeTree;
        this.declared = declared;
        this.redeclared = redeclared;
        this.ownedScopes = ownedScopes;
        this.diagnostics = diagnostics;
    }

    public ScopeTree getScopeTree() {
        return scopeTree;
    }

    /**
     * Symbol declared (or, for duplicates, redeclared) by this identifier; null for plain uses.
     */
    public Symbol declaredBy(Identifier identifier) {
        return declared.get(identifier);
    }

    public boolean isRedeclaration(Identifier identifier) {
        return redeclared.contains(identifier);
    }

    /**
     * Scope opened by a table, procedure or compool declaration, or -1.
     */
    public int scopeOf(Declaration declaration) {
        Integer index = ownedScopes.get(declaration);
        return index != null ? index : -1;
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
