package org.dxworks.jovialframe.session;

import org.dxworks.jovialframe.analyzer.AnalysisCancelledException;
import org.dxworks.jovialframe.analyzer.AnalysisPipeline;
import org.dxworks.jovialframe.analyzer.AnalysisSnapshot;
import org.dxworks.jovialframe.analyzer.InternalAnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps one open document analyzed.
 *
 * <p>Every edit bumps the generation counter. Passes run one at a time on the executor; edits that
 * arrive while a pass runs coalesce into a single follow-up pass on the latest text, and the running
 * pass gives up at its next stage boundary. Only the newest generation is ever published, with one
 * swap of the snapshot reference, so readers never wait and never see a half-built snapshot.</p>
 */
public class DocumentAnalysisSession implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentAnalysisSession.class);

    private final String uri;
    private final AnalysisPipeline pipeline;
    private final Executor executor;
    private final DiagnosticsListener listener;
    private final AtomicReference<AnalysisSnapshot> current = new AtomicReference<>();

    private final Object lock = new Object();
    private final List<Waiter> waiters = new ArrayList<>();
    private String text;
    private long generation;
    private String pendingText;
    private long pendingGeneration;
    private boolean draining;
    private SessionState state = SessionState.IDLE;
    private boolean closed;

    public DocumentAnalysisSession(String uri, String text, AnalysisPipeline pipeline,
                                   Executor executor, DiagnosticsListener listener) {
        this.uri = uri;
        this.pipeline = pipeline;
        this.executor = executor;
        this.listener = listener;
        update(text == null ? "" : text);
    }

    public String getUri() {
        return uri;
    }

    /**
     * Latest completed snapshot; empty until the first pass finishes.
     */
    public Optional<AnalysisSnapshot> currentSnapshot() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Text after the latest edit, which may not be analyzed yet.
     */
    public String getText() {
        synchronized (lock) {
            return text;
        }
    }

    public long getGeneration() {
        synchronized (lock) {
            return generation;
        }
    }

    public SessionState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    /**
     * Replaces the whole text.
     */
    public void update(String newText) {
        boolean startDrain;
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("session for " + uri + " is closed");
            }
            text = newText;
            generation++;
            pendingText = newText;
            pendingGeneration = generation;
            startDrain = !draining;
            draining = true;
        }
        if (startDrain) {
            executor.execute(this::drain);
        }
    }

    /**
     * Applies range edits, in order, to the text after the latest edit.
     */
    public void apply(List<TextEdit> edits) {
        String edited;
        synchronized (lock) {
            edited = TextEdit.applyAll(text, edits);
        }
        update(edited);
    }

    /**
     * Completes with the snapshot covering every edit made before this call. Completes exceptionally
     * when that pass fails internally or the session closes first.
     */
    public CompletableFuture<AnalysisSnapshot> awaitAnalysis() {
        synchronized (lock) {
            AnalysisSnapshot snapshot = current.get();
            if (snapshot != null && snapshot.getGeneration() >= generation) {
                return CompletableFuture.completedFuture(snapshot);
            }
            CompletableFuture<AnalysisSnapshot> future = new CompletableFuture<>();
            if (closed) {
                future.completeExceptionally(new IllegalStateException("session for " + uri + " is closed"));
                return future;
            }
            waiters.add(new Waiter(generation, future));
            return future;
        }
    }

    @Override
    public void close() {
        List<Waiter> abandoned;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            pendingText = null;
            abandoned = new ArrayList<>(waiters);
            waiters.clear();
        }
        current.set(null);
        for (Waiter waiter : abandoned) {
            waiter.future.completeExceptionally(new IllegalStateException("session for " + uri + " was closed"));
        }
        LOG.debug("Closed session for {}", uri);
    }

    private void drain() {
        long passGeneration = 0;
        try {
            while (true) {
                String passText;
                synchronized (lock) {
                    if (closed || pendingText == null) {
                        draining = false;
                        state = SessionState.IDLE;
                        return;
                    }
                    passText = pendingText;
                    passGeneration = pendingGeneration;
                    pendingText = null;
                    state = SessionState.ANALYZING;
                }
                runPass(passText, passGeneration);
            }
        } catch (RuntimeException | Error e) {
            abandonDrain(passGeneration, e);
            throw e;
        }
    }

    /**
     * Leaves the drain loop after an unexpected failure. Later edits still get a pass.
     */
    private void abandonDrain(long failedGeneration, Throwable cause) {
        LOG.error("Analysis of {} stopped at generation {}", uri, failedGeneration, cause);
        boolean resume;
        synchronized (lock) {
            resume = !closed && pendingText != null;
            draining = resume;
            if (!resume) {
                state = SessionState.IDLE;
            }
        }
        fail(failedGeneration, new InternalAnalysisException(
                "analysis of " + uri + " stopped at generation " + failedGeneration, cause));
        if (resume) {
            executor.execute(this::drain);
        }
    }

    private void runPass(String passText, long passGeneration) {
        AnalysisSnapshot snapshot;
        try {
            snapshot = pipeline.analyze(uri, passText, passGeneration, current.get(),
                    () -> isSuperseded(passGeneration));
        } catch (AnalysisCancelledException e) {
            LOG.debug("{}: {}", uri, e.getMessage());
            return;
        } catch (InternalAnalysisException e) {
            AnalysisSnapshot kept = current.get();
            LOG.error("Internal error analyzing {} (generation {}), keeping generation {}",
                    uri, passGeneration, kept != null ? kept.getGeneration() : "none", e);
            fail(passGeneration, e);
            return;
        }

        synchronized (lock) {
            if (closed || passGeneration != generation) {
                LOG.debug("{}: discarding generation {}, superseded by {}", uri, passGeneration, generation);
                return;
            }
            current.set(snapshot);
        }
        complete(snapshot);
        try {
            listener.diagnosticsPublished(uri, passGeneration, snapshot.getDiagnostics());
        } catch (RuntimeException e) {
            LOG.error("Diagnostics listener failed for {} (generation {})", uri, passGeneration, e);
        }
    }

    private boolean isSuperseded(long passGeneration) {
        synchronized (lock) {
            return closed || passGeneration != generation;
        }
    }

    private void complete(AnalysisSnapshot snapshot) {
        for (Waiter waiter : takeWaiters(snapshot.getGeneration())) {
            waiter.future.complete(snapshot);
        }
    }

    private void fail(long failedGeneration, InternalAnalysisException error) {
        boolean latest;
        synchronized (lock) {
            latest = failedGeneration == generation;
        }
        if (latest) {
            for (Waiter waiter : takeWaiters(failedGeneration)) {
                waiter.future.completeExceptionally(error);
            }
        }
    }

    private List<Waiter> takeWaiters(long upToGeneration) {
        List<Waiter> taken = new ArrayList<>();
        synchronized (lock) {
            Iterator<Waiter> iterator = waiters.iterator();
            while (iterator.hasNext()) {
                Waiter waiter = iterator.next();
                if (waiter.generation <= upToGeneration) {
                    taken.add(waiter);
                    iterator.remove();
                }
            }
        }
        return taken;
    }

    private static final class Waiter {
        final long generation;
        final CompletableFuture<AnalysisSnapshot> future;

        Waiter(long generation, CompletableFuture<AnalysisSnapshot> future) {
            this.generation = generation;
            this.future = future;
        }
    }
}
