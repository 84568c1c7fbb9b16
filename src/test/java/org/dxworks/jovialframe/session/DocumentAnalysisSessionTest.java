package org.dxworks.jovialframe.session;

import org.dxworks.jovialframe.JovialframeConfig;
import org.dxworks.jovialframe.analyzer.AnalysisPipeline;
import org.dxworks.jovialframe.analyzer.AnalysisSnapshot;
import org.dxworks.jovialframe.analyzer.InternalAnalysisException;
import org.dxworks.jovialframe.model.Position;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DocumentAnalysisSessionTest {

    private static final String URI = "file:///work/session.jov";

    private final List<Long> published = Collections.synchronizedList(new ArrayList<>());
    private final DiagnosticsListener listener = (uri, generation, diagnostics) -> published.add(generation);

    @Test
    void firstPassRunsOnOpen() {
        DocumentAnalysisSession session = new DocumentAnalysisSession(URI, "FOO := 1;",
                new AnalysisPipeline(JovialframeConfig.defaults()), Runnable::run, listener);

        AnalysisSnapshot snapshot = session.currentSnapshot().orElseThrow();
        assertEquals(1, snapshot.getGeneration());
        assertEquals(1, snapshot.getDiagnostics().size());
        assertEquals(List.of(1L), published);
        assertEquals(SessionState.IDLE, session.getState());
        assertTrue(session.awaitAnalysis().isDone());
    }

    @Test
    void editsWhileQueuedCoalesceIntoOnePass() {
        QueuedExecutor executor = new QueuedExecutor();
        CountingPipeline pipeline = new CountingPipeline();
        DocumentAnalysisSession session = new DocumentAnalysisSession(URI, "ITEM A S 8;", pipeline, executor, listener);

        session.update("ITEM B S 8;");
        session.update("ITEM C S 8;");
        CompletableFuture<AnalysisSnapshot> pending = session.awaitAnalysis();
        executor.runAll();

        assertEquals(1, pipeline.passes.get());
        assertEquals(List.of(3L), published);
        AnalysisSnapshot snapshot = pending.getNow(null);
        assertEquals(3, snapshot.getGeneration());
        assertEquals("ITEM C S 8;", snapshot.getText());
    }

    @Test
    void rangeEditsApplyToTheLatestText() {
        DocumentAnalysisSession session = new DocumentAnalysisSession(URI, "ITEM A S 8;\nA := 1;",
                new AnalysisPipeline(JovialframeConfig.defaults()), Runnable::run, listener);

        session.apply(List.of(TextEdit.replace(new Position(1, 5), new Position(1, 6), "2")));

        assertEquals("ITEM A S 8;\nA := 2;", session.getText());
        assertEquals(2, session.currentSnapshot().orElseThrow().getGeneration());
    }

    @Test
    void runningPassIsCancelledBySupersedingEdit() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AnalysisPipeline blocking = new AnalysisPipeline(JovialframeConfig.defaults()) {
            @Override
            public AnalysisSnapshot analyze(String uri, String text, long generation,
                                            AnalysisSnapshot previous, BooleanSupplier cancelled) {
                if (generation == 1) {
                    started.countDown();
                    awaitQuietly(release);
                }
                return super.analyze(uri, text, generation, previous, cancelled);
            }
        };
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            DocumentAnalysisSession session = new DocumentAnalysisSession(URI, "ITEM OLD S 8;", blocking, executor, listener);
            assertTrue(started.await(5, TimeUnit.SECONDS));

            session.update("ITEM NEW S 8;");
            CompletableFuture<AnalysisSnapshot> latest = session.awaitAnalysis();
            release.countDown();

            AnalysisSnapshot snapshot = latest.get(5, TimeUnit.SECONDS);
            assertEquals(2, snapshot.getGeneration());
            assertEquals("ITEM NEW S 8;", snapshot.getText());
            assertEquals(List.of(2L), published);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void internalErrorKeepsThePreviousSnapshot() {
        QueuedExecutor executor = new QueuedExecutor();
        AnalysisPipeline failing = new AnalysisPipeline(JovialframeConfig.defaults()) {
            @Override
            public AnalysisSnapshot analyze(String uri, String text, long generation,
                                            AnalysisSnapshot previous, BooleanSupplier cancelled) {
                if (text.contains("BOOM")) {
                    throw new InternalAnalysisException("stage broke");
                }
                return super.analyze(uri, text, generation, previous, cancelled);
            }
        };
        DocumentAnalysisSession session = new DocumentAnalysisSession(URI, "ITEM A S 8;", failing, executor, listener);
        executor.runAll();

        session.update("BOOM");
        CompletableFuture<AnalysisSnapshot> failed = session.awaitAnalysis();
        executor.runAll();

        ExecutionException e = assertThrows(ExecutionException.class, failed::get);
        assertInstanceOf(InternalAnalysisException.class, e.getCause());
        assertEquals(1, session.currentSnapshot().orElseThrow().getGeneration());
        assertEquals(List.of(1L), published);
    }

    @Test
    void unexpectedErrorDoesNotStopLaterPasses() {
        QueuedExecutor executor = new QueuedExecutor();
        AnalysisPipeline overflowing = new AnalysisPipeline(JovialframeConfig.defaults()) {
            @Override
            public AnalysisSnapshot analyze(String uri, String text, long generation,
                                            AnalysisSnapshot previous, BooleanSupplier cancelled) {
                if (text.contains("BOOM")) {
                    throw new StackOverflowError();
                }
                return super.analyze(uri, text, generation, previous, cancelled);
            }
        };
        DocumentAnalysisSession session = new DocumentAnalysisSession(URI, "ITEM A S 8;", overflowing, executor, listener);
        executor.runAll();

        session.update("BOOM");
        CompletableFuture<AnalysisSnapshot> failed = session.awaitAnalysis();
        assertThrows(StackOverflowError.class, executor::runAll);

        ExecutionException e = assertThrows(ExecutionException.class, failed::get);
        assertInstanceOf(InternalAnalysisException.class, e.getCause());
        assertEquals(SessionState.IDLE, session.getState());

        session.update("ITEM B S 8;");
        executor.runAll();

        AnalysisSnapshot snapshot = session.currentSnapshot().orElseThrow();
        assertEquals(3, snapshot.getGeneration());
        assertEquals("ITEM B S 8;", snapshot.getText());
    }

    @Test
    void failingListenerDoesNotStopLaterPasses() {
        DiagnosticsListener failing = (uri, generation, diagnostics) -> {
            published.add(generation);
            throw new IllegalStateException("listener broke");
        };
        DocumentAnalysisSession session = new DocumentAnalysisSession(URI, "ITEM A S 8;",
                new AnalysisPipeline(JovialframeConfig.defaults()), Runnable::run, failing);

        session.update("ITEM B S 8;");

        assertEquals(List.of(1L, 2L), published);
        assertEquals(2, session.currentSnapshot().orElseThrow().getGeneration());
        assertEquals(SessionState.IDLE, session.getState());
    }

    @Test
    void closingFailsWaitersAndRejectsEdits() {
        QueuedExecutor executor = new QueuedExecutor();
        DocumentAnalysisSession session = new DocumentAnalysisSession(URI, "ITEM A S 8;",
                new AnalysisPipeline(JovialframeConfig.defaults()), executor, listener);
        CompletableFuture<AnalysisSnapshot> pending = session.awaitAnalysis();

        session.close();
        executor.runAll();

        assertTrue(session.isClosed());
        assertTrue(pending.isCompletedExceptionally());
        assertTrue(session.currentSnapshot().isEmpty());
        assertTrue(published.isEmpty());
        assertThrows(IllegalStateException.class, () -> session.update("ITEM B S 8;"));
        assertTrue(session.awaitAnalysis().isCompletedExceptionally());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class QueuedExecutor implements Executor {
        private final Queue<Runnable> tasks = new ArrayDeque<>();

        @Override
        public void execute(Runnable task) {
            tasks.add(task);
        }

        void runAll() {
            Runnable task;
            while ((task = tasks.poll()) != null) {
                task.run();
            }
        }
    }

    private static final class CountingPipeline extends AnalysisPipeline {
        private final AtomicInteger passes = new AtomicInteger();

        CountingPipeline() {
            super(JovialframeConfig.defaults());
        }

        @Override
        public AnalysisSnapshot analyze(String uri, String text, long generation,
                                        AnalysisSnapshot previous, BooleanSupplier cancelled) {
            passes.incrementAndGet();
            return super.analyze(uri, text, generation, previous, cancelled);
        }
    }
}
