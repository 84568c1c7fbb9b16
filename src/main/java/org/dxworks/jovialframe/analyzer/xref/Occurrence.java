package org.dxworks.jovialframe.analyzer.xref;

import org.dxworks.jovialframe.analyzer.semantic.Symbol;
import org.dxworks.jovialframe.model.Span;

/**
 * One appearance of a name in the source, resolved to its symbol or left unresolved.
 */
public final class Occurrence {

    private final Span span;
    private final Symbol symbol;
    private final OccurrenceRole role;
    private final String name;
    private final int scopeIndex;

    public Occurrence(Span span, Symbol symbol, OccurrenceRole role, String name, int scopeIndex) {
        this.span = span;
        this.symbol = symbol;
        this.role = role;
        this.name = name;
        this.scopeIndex = scopeIndex;
    }

    public Span getSpan() {
        return span;
    }

    /**
     * Resolved symbol, or null for an unresolved use.
     */
    public Symbol getSymbol() {
        return symbol;
    }

    public OccurrenceRole getRole() {
        return role;
    }

    public String getName() {
        return name;
    }

    /**
     * Scope the name was looked up from.
     */
    public int getScopeIndex() {
        return scopeIndex;
    }

    public boolean isResolved() {
        return symbol != null;
    }

    public boolean isDeclaration() {
        return role == OccurrenceRole.DECLARATION;
    }

    @Override
    public String toString() {
        return role + " " + name + "@" + span + (symbol != null ? " -> " + symbol : " (unresolved)");
    }
}
