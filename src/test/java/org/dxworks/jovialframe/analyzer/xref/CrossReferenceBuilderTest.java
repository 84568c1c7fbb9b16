package org.dxworks.jovialframe.analyzer.xref;

import org.dxworks.jovialframe.analyzer.lexer.JovialLexer;
import org.dxworks.jovialframe.analyzer.parser.JovialParser;
import org.dxworks.jovialframe.analyzer.semantic.Symbol;
import org.dxworks.jovialframe.analyzer.semantic.SymbolTable;
import org.dxworks.jovialframe.analyzer.semantic.SymbolTableBuilder;
import org.dxworks.jovialframe.model.Diagnostic;
import org.dxworks.jovialframe.model.DiagnosticCategory;
import org.dxworks.jovialframe.model.ast.CompilationUnit;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CrossReferenceBuilderTest {

    @Test
    void statusItemAndValueOccurrences() {
        Indexed indexed = index("ITEM MODE STATUS (V(ON), V(OFF));\nMODE := V(ON);");

        Symbol mode = indexed.symbol("MODE");
        assertEquals(List.of(OccurrenceRole.DECLARATION, OccurrenceRole.WRITE), roles(indexed.xref.occurrencesOf(mode)));

        Symbol on = mode.getMembers().get(0);
        List<Occurrence> onOccurrences = indexed.xref.occurrencesOf(on);
        assertEquals(List.of(OccurrenceRole.DECLARATION, OccurrenceRole.READ), roles(onOccurrences));
        assertEquals(1, onOccurrences.get(1).getSpan().getStartLine());
        assertEquals(5, indexed.xref.size());
        assertTrue(indexed.xref.getDiagnostics().isEmpty());
    }

    @Test
    void unresolvedNameIsRecordedAndReported() {
        Indexed indexed = index("FOO := 1;");

        List<Occurrence> unresolved = indexed.xref.unresolved();
        assertEquals(1, unresolved.size());
        assertEquals("FOO", unresolved.get(0).getName());
        assertEquals(OccurrenceRole.WRITE, unresolved.get(0).getRole());
        Diagnostic diagnostic = indexed.xref.getDiagnostics().get(0);
        assertEquals(DiagnosticCategory.UNRESOLVED_REFERENCE, diagnostic.getCategory());
        assertEquals("unresolved reference to FOO", diagnostic.getMessage());
    }

    @Test
    void unresolvedReportingCanBeSwitchedOff() {
        CompilationUnit unit = JovialParser.parse(new JovialLexer("FOO := BAR;").tokenize()).unit;
        CrossReferenceIndex xref = CrossReferenceBuilder.build(unit, SymbolTableBuilder.build(unit), false);

        assertEquals(2, xref.unresolved().size());
        assertTrue(xref.getDiagnostics().isEmpty());
    }

    @Test
    void procedureUsesAreCalls() {
        Indexed indexed = index("PROC STEP;\nBEGIN\nEND\nSTEP;\nITEM R S 8;\nR := STEP;");

        Symbol step = indexed.symbol("STEP");
        assertEquals(List.of(OccurrenceRole.DECLARATION, OccurrenceRole.CALL, OccurrenceRole.CALL),
                roles(indexed.xref.occurrencesOf(step)));
    }

    @Test
    void duplicateNameIsARedeclarationOfTheFirstSymbol() {
        Indexed indexed = index("ITEM X S 16;\nITEM X U 8;\nX := 1;");

        List<Occurrence> occurrences = indexed.xref.occurrencesOf(indexed.symbol("X"));
        assertEquals(List.of(OccurrenceRole.DECLARATION, OccurrenceRole.REDECLARATION, OccurrenceRole.WRITE),
                roles(occurrences));
        assertEquals(0, occurrences.get(0).getSpan().getStartLine());
    }

    @Test
    void builtinFunctionsAreNotReferences() {
        Indexed indexed = index("ITEM A S 8;\nA := ABS(A);");

        assertTrue(indexed.xref.unresolved().isEmpty());
        assertEquals(List.of(OccurrenceRole.DECLARATION, OccurrenceRole.WRITE, OccurrenceRole.READ),
                roles(indexed.xref.occurrencesOf(indexed.symbol("A"))));
    }

    @Test
    void statusValuePrefersTheEnumerationOfTheTarget() {
        Indexed indexed = index("ITEM LIGHT STATUS (V(RED), V(GREEN));\n"
                + "PROC PAINT;\n"
                + "BEGIN\n"
                + "ITEM FLAG STATUS (V(GREEN), V(OFF));\n"
                + "LIGHT := V(GREEN);\n"
                + "FLAG := V(GREEN);\n"
                + "END");
        Symbol light = indexed.symbol("LIGHT");

        Occurrence forLight = indexed.xref.occurrenceAt(indexed.text.indexOf("V(GREEN);") + 2).orElseThrow();
        assertSame(light, forLight.getSymbol().getOwner());

        Occurrence forFlag = indexed.xref.occurrenceAt(indexed.text.lastIndexOf("GREEN")).orElseThrow();
        assertEquals("FLAG", forFlag.getSymbol().getOwner().getName());
        assertTrue(indexed.xref.getDiagnostics().isEmpty());
    }

    @Test
    void bareStatusValueNameResolvesToTheValue() {
        Indexed indexed = index("ITEM MODE STATUS (V(ON), V(OFF));\nITEM FLAG U 1;\nFLAG := ON;");

        Symbol on = indexed.symbol("ON");
        assertSame(indexed.symbol("MODE"), on.getOwner());
        assertEquals(List.of(OccurrenceRole.DECLARATION, OccurrenceRole.READ), roles(indexed.xref.occurrencesOf(on)));
        assertTrue(indexed.xref.unresolved().isEmpty());
        assertTrue(indexed.xref.getDiagnostics().isEmpty());
    }

    @Test
    void unknownStatusValueIsReported() {
        Indexed indexed = index("ITEM M STATUS (V(A));\nM := V(B);");

        assertEquals(List.of("unresolved status value V(B)"), indexed.xref.getDiagnostics().stream()
                .map(Diagnostic::getMessage)
                .collect(Collectors.toList()));
    }

    @Test
    void occurrenceAtFindsNameUnderAndRightBehindTheCursor() {
        Indexed indexed = index("ITEM SPEED F 32;\nSPEED := 1.5;");
        int start = indexed.text.indexOf("SPEED :=");

        assertEquals(OccurrenceRole.WRITE, indexed.xref.occurrenceAt(start).orElseThrow().getRole());
        assertEquals(OccurrenceRole.WRITE, indexed.xref.occurrenceAt(start + "SPEED".length()).orElseThrow().getRole());
        assertFalse(indexed.xref.occurrenceAt(start + "SPEED :".length()).isPresent());
    }

    @Test
    void verifyAcceptsBuiltIndex() {
        Indexed indexed = index("PROC MOVE (A : B);\nBEGIN\nITEM A S 8;\nB := A;\nEND");

        indexed.xref.verify(indexed.table.getScopeTree());
        assertTrue(indexed.xref.unresolved().isEmpty());
    }

    private static Indexed index(String text) {
        CompilationUnit unit = JovialParser.parse(new JovialLexer(text).tokenize()).unit;
        SymbolTable table = SymbolTableBuilder.build(unit);
        return new Indexed(text, table, CrossReferenceBuilder.build(unit, table, true));
    }

    private static List<OccurrenceRole> roles(List<Occurrence> occurrences) {
        return occurrences.stream().map(Occurrence::getRole).collect(Collectors.toList());
    }

    private static final class Indexed {
        final String text;
        final SymbolTable table;
        final CrossReferenceIndex xref;

        Indexed(String text, SymbolTable table, CrossReferenceIndex xref) {
            this.text = text;
            this.table = table;
            this.xref = xref;
        }

        Symbol symbol(String key) {
            return table.getScopeTree().resolve(0, key).orElseThrow();
        }
    }
}
