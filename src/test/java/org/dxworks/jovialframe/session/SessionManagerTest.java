package org.dxworks.jovialframe.session;

import org.dxworks.jovialframe.JovialframeConfig;
import org.dxworks.jovialframe.analyzer.AnalysisPipeline;
import org.dxworks.jovialframe.analyzer.AnalysisSnapshot;
import org.dxworks.jovialframe.model.DiagnosticCategory;
import org.dxworks.jovialframe.model.Position;
import org.dxworks.jovialframe.model.query.DocumentSymbol;
import org.dxworks.jovialframe.model.query.HoverInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SessionManagerTest {

    private static final String URI = "file:///work/nav.jov";
    private static final String TEXT = "ITEM COUNT S 16;\nCOUNT := COUNT + 1;";

    private final SessionManager manager = new SessionManager(
            new AnalysisPipeline(JovialframeConfig.defaults()), Runnable::run, DiagnosticsListener.NONE);

    @AfterEach
    void tearDown() {
        manager.close();
    }

    @Test
    void queriesAnswerFromTheOpenDocument() {
        manager.open(URI, TEXT);

        assertTrue(manager.isOpen(URI));
        assertTrue(manager.diagnostics(URI).isEmpty());
        HoverInfo hover = manager.hover(URI, new Position(1, 0)).orElseThrow();
        assertEquals("Item", hover.kind);
        assertEquals(0, manager.definition(URI, new Position(1, 0)).orElseThrow().getSpan().getStartLine());
        assertEquals(3, manager.references(URI, new Position(0, 5)).size());
        assertEquals(2, manager.references(URI, new Position(0, 5), false).size());
        List<DocumentSymbol> outline = manager.documentSymbols(URI);
        assertEquals("COUNT", outline.get(0).name);
        assertFalse(manager.completion(URI, new Position(1, 9)).isEmpty());
    }

    @Test
    void changesReplaceTheSnapshot() {
        manager.open(URI, TEXT);

        manager.change(URI, "FOO := 1;");

        assertEquals(DiagnosticCategory.UNRESOLVED_REFERENCE, manager.diagnostics(URI).get(0).getCategory());
        assertEquals(2, manager.snapshot(URI).orElseThrow().getGeneration());
    }

    @Test
    void rangeChangesAreApplied() {
        manager.open(URI, TEXT);

        manager.change(URI, List.of(TextEdit.replace(new Position(1, 0), new Position(1, 5), "TOTAL")));

        assertEquals("ITEM COUNT S 16;\nTOTAL := COUNT + 1;", manager.snapshot(URI).orElseThrow().getText());
        assertEquals(1, manager.diagnostics(URI).size());
    }

    @Test
    void reopeningReplacesTheText() {
        manager.open(URI, TEXT);
        manager.open(URI, "ITEM OTHER U 8;");

        assertEquals("ITEM OTHER U 8;", manager.snapshot(URI).orElseThrow().getText());
    }

    @Test
    void concurrentOpensShareOneSession() throws Exception {
        ExecutorService callers = Executors.newFixedThreadPool(8);
        try (SessionManager pooled = new SessionManager(JovialframeConfig.defaults(), DiagnosticsListener.NONE)) {
            List<Callable<Void>> opens = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                opens.add(() -> {
                    pooled.open(URI, TEXT);
                    return null;
                });
            }
            for (Future<Void> open : callers.invokeAll(opens)) {
                open.get(5, TimeUnit.SECONDS);
            }

            AnalysisSnapshot snapshot = pooled.awaitAnalysis(URI).get(5, TimeUnit.SECONDS);

            assertEquals(8, snapshot.getGeneration());
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void unknownDocumentsGiveEmptyAnswers() {
        manager.change("file:///work/missing.jov", "ITEM A S 8;");

        assertFalse(manager.isOpen("file:///work/missing.jov"));
        assertTrue(manager.diagnostics("file:///work/missing.jov").isEmpty());
        assertTrue(manager.hover("file:///work/missing.jov", new Position(0, 0)).isEmpty());
        assertTrue(manager.awaitAnalysis("file:///work/missing.jov").isCompletedExceptionally());
    }

    @Test
    void closedDocumentIsForgotten() {
        manager.open(URI, TEXT);

        manager.close(URI);

        assertFalse(manager.isOpen(URI));
        assertTrue(manager.snapshot(URI).isEmpty());
        assertTrue(manager.documentSymbols(URI).isEmpty());
    }

    @Test
    void ownedWorkerPoolAnalyzesInTheBackground() throws Exception {
        try (SessionManager pooled = new SessionManager(JovialframeConfig.defaults(), DiagnosticsListener.NONE)) {
            pooled.open(URI, TEXT);
            pooled.change(URI, TEXT + "\nCOUNT := 0;");

            AnalysisSnapshot snapshot = pooled.awaitAnalysis(URI).get(5, TimeUnit.SECONDS);

            assertEquals(2, snapshot.getGeneration());
            assertEquals(4, snapshot.getCrossReferences().size());
        }
    }

    @Test
    void runawayNestingDoesNotStallTheDocument() throws Exception {
        try (SessionManager pooled = new SessionManager(JovialframeConfig.defaults(), DiagnosticsListener.NONE)) {
            pooled.open(URI, "ITEM A S 8;");
            pooled.change(URI, "A := " + "(".repeat(60000) + "1;");
            pooled.awaitAnalysis(URI).get(5, TimeUnit.SECONDS);
            pooled.change(URI, "ITEM B S 8;");

            pooled.awaitAnalysis(URI).get(5, TimeUnit.SECONDS);

            assertEquals("B", pooled.documentSymbols(URI).get(0).name);
        }
    }
}
