package org.dxworks.jovialframe.analyzer.semantic;

import org.dxworks.jovialframe.analyzer.lexer.JovialLexer;
import org.dxworks.jovialframe.analyzer.parser.JovialParser;
import org.dxworks.jovialframe.model.Diagnostic;
import org.dxworks.jovialframe.model.DiagnosticCategory;
import org.dxworks.jovialframe.model.DiagnosticSeverity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SymbolTableBuilderTest {

    @Test
    void unnamedProgramGetsMainRoot() {
        ScopeTree tree = build("ITEM COUNT S 16;").getScopeTree();

        Scope root = tree.getRoot();
        assertEquals("MAIN", root.getName());
        assertEquals(ScopeKind.PROGRAM, root.getKind());
        Symbol count = root.lookupLocal("COUNT").orElseThrow();
        assertEquals(SymbolKind.ITEM, count.getKind());
        assertEquals("S 16", count.getType());
    }

    @Test
    void namedProgramNamesTheRoot() {
        assertEquals("FLIGHT", build("START FLIGHT;\nITEM A S 8;\nTERM;").getScopeTree().getRoot().getName());
    }

    @Test
    void namesAreCaseInsensitive() {
        ScopeTree tree = build("ITEM Speed F 32;").getScopeTree();

        Symbol speed = tree.resolve(0, "SPEED").orElseThrow();
        assertEquals("Speed", speed.getName());
    }

    @Test
    void duplicateKeepsFirstDeclarationAndWarnsOnce() {
        SymbolTable table = build("ITEM X S 16;\nITEM X U 8;");

        assertEquals(1, table.getDiagnostics().size());
        Diagnostic duplicate = table.getDiagnostics().get(0);
        assertEquals(DiagnosticCategory.DUPLICATE_DECLARATION, duplicate.getCategory());
        assertEquals(DiagnosticSeverity.WARNING, duplicate.getSeverity());
        assertEquals("duplicate declaration of X (first declared at line 1)", duplicate.getMessage());
        assertEquals(1, duplicate.getSpan().getStartLine());
        assertEquals("S 16", table.getScopeTree().resolve(0, "X").orElseThrow().getType());
        assertEquals(1, table.getScopeTree().getSymbols().size());
    }

    @Test
    void procedureOpensScopeWithParameters() {
        ScopeTree tree = build("PROC MOVE (A : B);\nBEGIN\nITEM A S 8;\nEND").getScopeTree();

        Symbol move = tree.getRoot().lookupLocal("MOVE").orElseThrow();
        assertEquals(SymbolKind.PROCEDURE, move.getKind());
        assertEquals("(A : B)", move.getDetails().get("parameters"));

        Scope body = tree.get(move.getOwnedScopeIndex());
        assertEquals(ScopeKind.PROCEDURE, body.getKind());
        assertEquals(0, body.getParentIndex());
        assertSame(move, body.getOwner());

        Symbol a = body.lookupLocal("A").orElseThrow();
        assertEquals(SymbolKind.PARAMETER, a.getKind());
        assertEquals("S 8", a.getType());
        assertEquals("input", a.getDetails().get("mode"));
        assertSame(move, a.getOwner());

        Symbol b = body.lookupLocal("B").orElseThrow();
        assertEquals(SymbolKind.PARAMETER, b.getKind());
        assertNull(b.getType());
        assertEquals("output", b.getDetails().get("mode"));
    }

    @Test
    void tableItemsStayInsideTheTableScope() {
        ScopeTree tree = build("TABLE DATA (1:10);\nBEGIN\nITEM VALUE F 32;\nEND").getScopeTree();

        Symbol data = tree.getRoot().lookupLocal("DATA").orElseThrow();
        assertEquals(SymbolKind.TABLE, data.getKind());
        assertEquals("TABLE (1:10)", data.getType());
        Scope block = tree.get(data.getOwnedScopeIndex());
        assertEquals(ScopeKind.TABLE_BLOCK, block.getKind());
        assertTrue(block.lookupLocal("VALUE").isPresent());
        assertTrue(tree.resolve(0, "VALUE").isEmpty());
    }

    @Test
    void statusValuesAreSiblingsOfTheirEnumeration() {
        ScopeTree tree = build("ITEM MODE STATUS (V(ON), V(OFF));").getScopeTree();

        Symbol mode = tree.getRoot().lookupLocal("MODE").orElseThrow();
        assertEquals(SymbolKind.STATUS, mode.getKind());
        assertEquals(List.of("ON", "OFF"), mode.getMembers().stream().map(Symbol::getName).collect(Collectors.toList()));

        Symbol on = tree.resolve(0, "ON").orElseThrow();
        assertEquals(SymbolKind.STATUS_VALUE, on.getKind());
        assertSame(mode, on.getOwner());
        assertEquals(0, on.getScopeIndex());
        assertEquals(List.of("MODE", "ON", "OFF"), tree.getRoot().getSymbols().stream()
                .map(Symbol::getName)
                .collect(Collectors.toList()));
    }

    @Test
    void itemNamedLikeAStatusValueIsADuplicate() {
        SymbolTable table = build("ITEM MODE STATUS (V(ON), V(OFF));\nITEM ON U 1;");

        assertEquals(List.of("duplicate declaration of ON (first declared at line 1)"), table.getDiagnostics().stream()
                .map(Diagnostic::getMessage)
                .collect(Collectors.toList()));
        assertEquals(1, table.getDiagnostics().get(0).getSpan().getStartLine());
        assertEquals(SymbolKind.STATUS_VALUE, table.getScopeTree().resolve(0, "ON").orElseThrow().getKind());
    }

    @Test
    void valueRepeatedInOneEnumerationIsADuplicate() {
        SymbolTable table = build("ITEM MODE STATUS (V(ON), V(ON));");

        assertEquals(1, table.getDiagnostics().size());
        assertEquals(DiagnosticCategory.DUPLICATE_DECLARATION, table.getDiagnostics().get(0).getCategory());
        assertEquals(1, table.getScopeTree().getRoot().lookupLocal("MODE").orElseThrow().getMembers().size());
    }

    @Test
    void compoolDeclarationsAreVisibleToTheEnclosingScope() {
        ScopeTree tree = build("COMPOOL SHARED;\nBEGIN\nITEM LIMIT U 8;\nEND\nLIMIT := 1;").getScopeTree();

        Symbol limit = tree.resolve(0, "LIMIT").orElseThrow();
        assertEquals(ScopeKind.COMPOOL, tree.get(limit.getScopeIndex()).getKind());
    }

    @Test
    void undeclaredSingleLetterForVariableBecomesLoopVariable() {
        ScopeTree tree = build("ITEM TOTAL S 16;\nFOR I : 1 BY 1 WHILE I < 10;\n  TOTAL := TOTAL + I;").getScopeTree();

        assertEquals(SymbolKind.LOOP_VARIABLE, tree.getRoot().lookupLocal("I").orElseThrow().getKind());
    }

    @Test
    void statementLabelsAreDeclared() {
        ScopeTree tree = build("LOOP'TOP: A := 1;").getScopeTree();

        assertEquals(SymbolKind.LABEL, tree.getRoot().lookupLocal("LOOP'TOP").orElseThrow().getKind());
    }

    @Test
    void typeConsistencyWarnings() {
        SymbolTable table = build("ITEM NAME C 8 = 5;\nITEM PTR P 16;\nITEM EMPTY S 0;\nITEM RATIO S 8,2;");

        List<String> messages = table.getDiagnostics().stream()
                .filter(d -> d.getCategory() == DiagnosticCategory.TYPE_CONSISTENCY)
                .map(Diagnostic::getMessage)
                .collect(Collectors.toList());
        assertEquals(List.of(
                "initial value 5 does not match type C 8",
                "pointer type takes no width: P 16",
                "width of S 0 must be positive",
                "scale is only allowed on fixed types, not S 8,2"), messages);
    }

    @Test
    void leadingCommentIsSymbolDocumentation() {
        ScopeTree tree = build("\"engine speed\"\nITEM RPM U 16;").getScopeTree();

        assertEquals("engine speed", tree.resolve(0, "RPM").orElseThrow().getDocumentation());
    }

    private static SymbolTable build(String text) {
        return SymbolTableBuilder.build(JovialParser.parse(new JovialLexer(text).tokenize()).unit);
    }
}
