package org.dxworks.jovialframe.analyzer.semantic;

import org.dxworks.jovialframe.model.Span;
import org.dxworks.jovialframe.model.ast.Declaration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A declared name. Symbols are created by {@link SymbolTableBuilder} and read-only afterwards.
 */
public final class Symbol {

    private final int id;
    private final String name;
    private final String key;
    private final SymbolKind kind;
    private final String type;
    private final int scopeIndex;
    private final Span declarationSpan;
    private final Span extent;
    private final String documentation;
    private final Declaration declaration;
    private final List<Symbol> members = new ArrayList<>();
    private final Map<String, String> details = new LinkedHashMap<>();
    private Symbol owner;
    private Symbol valueSet;
    private int ownedScopeIndex = -1;

    Symbol(int id, String name, SymbolKind kind, String type, int scopeIndex,
           Span declarationSpan, Span extent, String documentation, Declaration declaration) {
        this.id = id;
        this.name = name;
        this.key = name.toUpperCase(Locale.ROOT);
        this.kind = kind;
        this.type = type;
        this.scopeIndex = scopeIndex;
        this.declarationSpan = declarationSpan;
        this.extent = extent;
        this.documentation = documentation;
        this.declaration = declaration;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /**
     * Upper-case name; JOVIAL names compare case-insensitively.
     */
    public String getKey() {
        return key;
    }

    public SymbolKind getKind() {
        return kind;
    }

    /**
     * Type descriptor such as {@code S 16}, or null when the declaration has none.
     */
    public String getType() {
        return type;
    }

    public int getScopeIndex() {
        return scopeIndex;
    }

    /**
     * Span of the declaring name.
     */
    public Span getDeclarationSpan() {
        return declarationSpan;
    }

    /**
     * Span of the whole declaration.
     */
    public Span getExtent() {
        return extent;
    }

    public String getDocumentation() {
        return documentation;
    }

    public Declaration getDeclaration() {
        return declaration;
    }

    /**
     * Status values of a STATUS enumeration or of a status TYPE.
     */
    public List<Symbol> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public Map<String, String> getDetails() {
        return Collections.unmodifiableMap(details);
    }

    /**
     * Enumeration of a status value, procedure of a parameter; null otherwise.
     */
    public Symbol getOwner() {
        return owner;
    }

    /**
     * Symbol whose members are the status values this symbol takes, or null.
     */
    public Symbol getValueSet() {
        return valueSet;
    }

    /**
     * Index of the scope opened by this declaration (tables, procedures, compools), or -1.
     */
    public int getOwnedScopeIndex() {
        return ownedScopeIndex;
    }

    void addMember(Symbol member) {
        members.add(member);
    }

    void putDetail(String name, String value) {
        if (value != null && !value.isEmpty()) {
            details.put(name, value);
        }
    }

    void setOwner(Symbol owner) {
        this.owner = owner;
    }

    void setValueSet(Symbol valueSet) {
        this.valueSet = valueSet;
    }

    void setOwnedScopeIndex(int ownedScopeIndex) {
        this.ownedScopeIndex = ownedScopeIndex;
    }

    @Override
    public String toString() {
        return kind + " " + name + "#" + id;
    }
}
