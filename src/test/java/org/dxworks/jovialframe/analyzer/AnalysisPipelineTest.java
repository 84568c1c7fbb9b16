package org.dxworks.jovialframe.analyzer;

import org.dxworks.jovialframe.JovialframeConfig;
import org.dxworks.jovialframe.SourceRole;
import org.dxworks.jovialframe.analyzer.lexer.JovialLexer;
import org.dxworks.jovialframe.model.Diagnostic;
import org.dxworks.jovialframe.model.DiagnosticCategory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AnalysisPipelineTest {

    private static final String URI = "file:///work/demo.jov";
    private static final String TEXT = String.join("\n",
            "START DEMO;",
            "!COMPOOL 'NAVDATA';",
            "ITEM COUNT S 16;",
            "COUNT := COUNT + 1;",
            "TERM DEMO;");

    private final AnalysisPipeline pipeline = new AnalysisPipeline(JovialframeConfig.defaults());

    @Test
    void oneOffAnalysisBuildsEveryStage() {
        AnalysisSnapshot snapshot = pipeline.analyze(URI, TEXT);

        assertEquals(URI, snapshot.getUri());
        assertEquals(SourceRole.PROGRAM, snapshot.getRole());
        assertEquals(0, snapshot.getGeneration());
        assertEquals("DEMO", snapshot.getScopeTree().getRoot().getName());
        assertEquals(3, snapshot.getCrossReferences().size());
        assertEquals(List.of("NAVDATA"), snapshot.getCompoolDirectives());
        assertTrue(snapshot.getDiagnostics().isEmpty());
    }

    @Test
    void compoolFileGetsCompoolRole() {
        AnalysisSnapshot snapshot = pipeline.analyze("file:///work/shared.cpl", "START COMPOOL SHARED;\nTERM;");

        assertEquals(SourceRole.COMPOOL, snapshot.getRole());
    }

    @Test
    void diagnosticsOfAllStagesAreMergedInPositionOrder() {
        AnalysisSnapshot snapshot = pipeline.analyze(URI, "ITEM A S 8;\nA := 12X;\nITEM A U 4;\nB := 1;");

        List<DiagnosticCategory> categories = snapshot.getDiagnostics().stream()
                .map(Diagnostic::getCategory)
                .collect(Collectors.toList());
        assertEquals(List.of(DiagnosticCategory.LEX_ERROR, DiagnosticCategory.PARSE_ERROR,
                DiagnosticCategory.DUPLICATE_DECLARATION, DiagnosticCategory.UNRESOLVED_REFERENCE), categories);
        assertEquals("malformed numeric literal 12X", snapshot.getDiagnostics().get(0).getMessage());
    }

    @Test
    void analyzingTheSameTextTwiceGivesTheSameResult() {
        AnalysisSnapshot first = pipeline.analyze(URI, TEXT);
        AnalysisSnapshot second = pipeline.analyze(URI, TEXT);

        assertEquals(first.getTokens(), second.getTokens());
        assertEquals(first.getDiagnostics(), second.getDiagnostics());
        assertEquals(first.getScopeTree().getSymbols().size(), second.getScopeTree().getSymbols().size());
    }

    @Test
    void previousSnapshotIsUsedForIncrementalLexing() {
        AnalysisSnapshot previous = pipeline.analyze(URI, TEXT);
        String edited = TEXT.replace("COUNT + 1", "COUNT + 2");

        AnalysisSnapshot next = pipeline.analyze(URI, edited, 1, previous, () -> false);

        assertEquals(1, next.getGeneration());
        assertEquals(new JovialLexer(edited).tokenize(), next.getTokens());
    }

    @Test
    void cancelledPassStopsAtTheFirstBoundary() {
        AnalysisCancelledException e = assertThrows(AnalysisCancelledException.class,
                () -> pipeline.analyze(URI, TEXT, 7, null, () -> true));

        assertEquals(7, e.getGeneration());
        assertEquals("analysis of generation 7 cancelled before lexing", e.getMessage());
    }

    @Test
    void passCancelledMidwayStopsAtTheNextBoundary() {
        AtomicInteger checks = new AtomicInteger();

        AnalysisCancelledException e = assertThrows(AnalysisCancelledException.class,
                () -> pipeline.analyze(URI, TEXT, 3, null, () -> checks.incrementAndGet() > 2));

        assertEquals("analysis of generation 3 cancelled before symbol table", e.getMessage());
    }

    @Test
    void failingStageBecomesInternalError() {
        AnalysisPipeline broken = new AnalysisPipeline(null);

        InternalAnalysisException e = assertThrows(InternalAnalysisException.class, () -> broken.analyze(URI, TEXT));

        assertNotNull(e.getCause());
        assertEquals("analysis of " + URI + " failed at generation 0", e.getMessage());
    }

    @Test
    void nullTextIsAnalyzedAsEmpty() {
        AnalysisSnapshot snapshot = pipeline.analyze(URI, null);

        assertEquals("", snapshot.getText());
        assertEquals("MAIN", snapshot.getScopeTree().getRoot().getName());
    }
}
