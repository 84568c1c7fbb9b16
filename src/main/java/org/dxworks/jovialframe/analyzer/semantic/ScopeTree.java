package org.dxworks.jovialframe.analyzer.semantic;

import org.dxworks.jovialframe.analyzer.InternalAnalysisException;
import org.dxworks.jovialframe.model.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Arena of scopes. Index 0 is the PROGRAM root; parents are referenced by index and always precede
 * their children.
 */
public final class ScopeTree {

    private final List<Scope> scopes = new ArrayList<>();
    private final List<Symbol> symbols = new ArrayList<>();

    Scope addScope(ScopeKind kind, String name, int parentIndex, Span extent) {
        Scope scope = new Scope(scopes.size(), kind, name, parentIndex, extent);
        if (parentIndex >= 0) {
            scopes.get(parentIndex).addChild(scope.getIndex());
        }
        scopes.add(scope);
        return scope;
    }

    void register(Symbol symbol) {
        symbols.add(symbol);
    }

    int nextSymbolId() {
        return symbols.size();
    }

    public Scope getRoot() {
        return scopes.get(0);
    }

    public Scope get(int index) {
        return scopes.get(index);
    }

    public List<Scope> getScopes() {
        return Collections.unmodifiableList(scopes);
    }

    /**
     * Every symbol of the document, in creation order.
     */
    public List<Symbol> getSymbols() {
        return Collections.unmodifiableList(symbols);
    }

    public Optional<Scope> parentOf(Scope scope) {
        return scope.getParentIndex() < 0 ? Optional.empty() : Optional.of(scopes.get(scope.getParentIndex()));
    }

    /**
     * The scope at {@code scopeIndex} followed by its ancestors up to the root.
     */
    public List<Scope> chain(int scopeIndex) {
        List<Scope> chain = new ArrayList<>();
        for (int i = scopeIndex; i >= 0; i = scopes.get(i).getParentIndex()) {
            chain.add(scopes.get(i));
        }
        return chain;
    }

    /**
     * Scopes searched by a lookup from {@code scopeIndex}: each scope of the chain, directly followed
     * by the compools nested in it, whose declarations are visible to the enclosing scope.
     */
    public List<Scope> searchOrder(int scopeIndex) {
        List<Scope> order = new ArrayList<>();
        for (Scope scope : chain(scopeIndex)) {
            addWithCompools(scope, order);
        }
        return order;
    }

    private void addWithCompools(Scope scope, List<Scope> order) {
        if (!order.contains(scope)) {
            order.add(scope);
        }
        for (int child : scope.getChildIndices()) {
            Scope childScope = scopes.get(child);
            if (childScope.getKind() == ScopeKind.COMPOOL) {
                addWithCompools(childScope, order);
            }
        }
    }

    /**
     * Innermost-outward lookup; the first match wins.
     */
    public Optional<Symbol> resolve(int scopeIndex, String key) {
        for (Scope scope : searchOrder(scopeIndex)) {
            Optional<Symbol> symbol = scope.lookupLocal(key);
            if (symbol.isPresent()) {
                return symbol;
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a {@code V(name)} value. A member of {@code preferredSet} wins; otherwise the first
     * visible status value of that name.
     */
    public Optional<Symbol> resolveStatusValue(int scopeIndex, String key, Symbol preferredSet) {
        if (preferredSet != null) {
            for (Symbol member : preferredSet.getMembers()) {
                if (member.getKey().equals(key)) {
                    return Optional.of(member);
                }
            }
        }
        for (Scope scope : searchOrder(scopeIndex)) {
            Optional<Symbol> value = scope.lookupLocal(key).filter(symbol -> symbol.getKind() == SymbolKind.STATUS_VALUE);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * Deepest scope whose extent touches {@code offset}; the root when none does.
     */
    public Scope innermostAt(int offset) {
        Scope current = getRoot();
        boolean descended = true;
        while (descended) {
            descended = false;
            for (int child : current.getChildIndices()) {
                Scope candidate = scopes.get(child);
                if (candidate.getExtent() != null && candidate.getExtent().getStartOffset() < offset
                        && candidate.getExtent().touches(offset)) {
                    current = candidate;
                    descended = true;
                    break;
                }
            }
        }
        return current;
    }

    /**
     * Checks the structural invariants; a violation is a bug in the builder.
     */
    public void verify() {
        if (scopes.isEmpty() || getRoot().getKind() != ScopeKind.PROGRAM || getRoot().getParentIndex() != -1) {
            throw new InternalAnalysisException("scope tree has no PROGRAM root");
        }
        for (int i = 1; i < scopes.size(); i++) {
            int parent = scopes.get(i).getParentIndex();
            if (parent < 0 || parent >= i) {
                throw new InternalAnalysisException("scope " + i + " has invalid parent " + parent);
            }
        }
        for (int i = 0; i < symbols.size(); i++) {
            Symbol symbol = symbols.get(i);
            if (symbol.getId() != i) {
                throw new InternalAnalysisException("symbol " + symbol + " registered out of order");
            }
            int scopeIndex = symbol.getScopeIndex();
            if (scopeIndex < 0 || scopeIndex >= scopes.size() || !scopes.get(scopeIndex).contains(symbol)) {
                throw new InternalAnalysisException("symbol " + symbol + " is not bound in its scope");
            }
        }
    }
}
