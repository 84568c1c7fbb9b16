package org.dxworks.jovialframe.analyzer;

import org.dxworks.jovialframe.SourceRole;
import org.dxworks.jovialframe.analyzer.lexer.LineIndex;
import org.dxworks.jovialframe.analyzer.lexer.Token;
import org.dxworks.jovialframe.analyzer.semantic.ScopeTree;
import org.dxworks.jovialframe.analyzer.semantic.SymbolTable;
import org.dxworks.jovialframe.analyzer.xref.CrossReferenceIndex;
import org.dxworks.jovialframe.model.Diagnostic;
import org.dxworks.jovialframe.model.ast.CompilationUnit;

import java.util.Collections;
import java.util.List;

/**
 * Result of one completed analysis pass over a document. Nothing in a snapshot changes after it is
 * published, so any number of queries can read it without locking.
 */
public final class AnalysisSnapshot {

    private final String uri;
    private final SourceRole role;
    private final long generation;
    private final String text;
    private final LineIndex lineIndex;
    private final List<Token> tokens;
    private final CompilationUnit unit;
    private final SymbolTable symbolTable;
    private final CrossReferenceIndex crossReferences;
    private final List<Diagnostic> diagnostics;
    private final List<String> compoolDirectives;

    AnalysisSnapshot(String uri, SourceRole role, long generation, String text, LineIndex lineIndex,
                     List<Token> tokens, CompilationUnit unit, SymbolTable symbolTable,
                     CrossReferenceIndex crossReferences, List<Diagnostic> diagnostics,
                     List<String> compoolDirectives) {
        this.uri = uri;
        this.role = role;
        this.generation = generation;
        this.text = text;
        this.lineIndex = lineIndex;
        this.tokens = Collections.unmodifiableList(tokens);
        this.unit = unit;
        this.symbolTable = symbolTable;
        this.crossReferences = crossReferences;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
        this.compoolDirectives = Collections.unmodifiableList(compoolDirectives);
    }

    public String getUri() {
        return uri;
    }

    public SourceRole getRole() {
        return role;
    }

    public long getGeneration() {
        return generation;
    }

    public String getText() {
        return text;
    }

    public LineIndex getLineIndex() {
        return lineIndex;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    /**
     * Syntax tree. The tree is shared with the symbol table and must not be modified.
     */
    public CompilationUnit getUnit() {
        return unit;
    }

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    public ScopeTree getScopeTree() {
        return symbolTable.getScopeTree();
    }

    public CrossReferenceIndex getCrossReferences() {
        return crossReferences;
    }

    /**
     * Lexical, syntax and semantic diagnostics in source order.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * Names given by {@code !COMPOOL} directives, in source order. They are recorded, not resolved.
     */
    public List<String> getCompoolDirectives() {
        return compoolDirectives;
    }
}
