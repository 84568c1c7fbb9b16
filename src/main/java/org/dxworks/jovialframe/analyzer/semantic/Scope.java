package org.dxworks.jovialframe.analyzer.semantic;

import org.dxworks.jovialframe.model.Span;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One level of the scope tree. Status values are bound here next to the name of their enumeration.
 */
public final class Scope {

    private final int index;
    private final ScopeKind kind;
    private final String name;
    private final int parentIndex;
    private final Span extent;
    private final List<Integer> childIndices = new ArrayList<>();
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private Symbol owner;

    Scope(int index, ScopeKind kind, String name, int parentIndex, Span extent) {
        this.index = index;
        this.kind = kind;
        this.name = name;
        this.parentIndex = parentIndex;
        this.extent = extent;
    }

    public int getIndex() {
        return index;
    }

    public ScopeKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    /**
     * Index of the enclosing scope, -1 for the root.
     */
    public int getParentIndex() {
        return parentIndex;
    }

    public Span getExtent() {
        return extent;
    }

    public List<Integer> getChildIndices() {
        return Collections.unmodifiableList(childIndices);
    }

    /**
     * Symbol whose declaration opened this scope; null for the root.
     */
    public Symbol getOwner() {
        return owner;
    }

    /**
     * Symbols in declaration order, status values included.
     */
    public Collection<Symbol> getSymbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }

    public Optional<Symbol> lookupLocal(String key) {
        return Optional.ofNullable(symbols.get(key));
    }

    boolean contains(Symbol symbol) {
        return symbols.get(symbol.getKey()) == symbol;
    }

    void addChild(int childIndex) {
        childIndices.add(childIndex);
    }

    void setOwner(Symbol owner) {
        this.owner = owner;
    }

    /**
     * Binds {@code symbol} unless the name is taken; returns the symbol already bound in that case.
     */
    Symbol bind(Symbol symbol) {
        return symbols.putIfAbsent(symbol.getKey(), symbol);
    }

    @Override
    public String toString() {
        return kind + " " + name + "#" + index;
    }
}
