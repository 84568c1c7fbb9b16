package org.dxworks.jovialframe.session;

import org.dxworks.jovialframe.JovialframeConfig;
import org.dxworks.jovialframe.analyzer.AnalysisPipeline;
import org.dxworks.jovialframe.analyzer.AnalysisSnapshot;
import org.dxworks.jovialframe.model.Diagnostic;
import org.dxworks.jovialframe.model.Position;
import org.dxworks.jovialframe.model.query.CompletionItem;
import org.dxworks.jovialframe.model.query.DocumentSymbol;
import org.dxworks.jovialframe.model.query.HoverInfo;
import org.dxworks.jovialframe.model.query.Location;
import org.dxworks.jovialframe.query.QueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Owns the table of open documents and answers editor requests against their latest snapshots.
 * Queries never wait for a running pass; before the first pass of a document completes they give
 * empty answers.
 */
public class SessionManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SessionManager.class);

    private final Map<String, DocumentAnalysisSession> sessions = new ConcurrentHashMap<>();
    private final AnalysisPipeline pipeline;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final DiagnosticsListener listener;
    private final QueryService queries = new QueryService();

    public SessionManager() {
        this(JovialframeConfig.load(), DiagnosticsListener.NONE);
    }

    public SessionManager(JovialframeConfig config, DiagnosticsListener listener) {
        this.pipeline = new AnalysisPipeline(config);
        this.ownedExecutor = Executors.newFixedThreadPool(config.getAnalysisThreads(), new AnalysisThreadFactory());
        this.executor = ownedExecutor;
        this.listener = listener;
    }

    /**
     * Runs passes on {@code executor}, which stays owned by the caller.
     */
    public SessionManager(AnalysisPipeline pipeline, Executor executor, DiagnosticsListener listener) {
        this.pipeline = pipeline;
        this.executor = executor;
        this.ownedExecutor = null;
        this.listener = listener;
    }

    /**
     * Opens a document; opening an already open document replaces its text.
     */
    public void open(String uri, String text) {
        sessions.compute(uri, (key, existing) -> {
            if (existing != null) {
                existing.update(text);
                return existing;
            }
            LOG.debug("Opened {}", key);
            return new DocumentAnalysisSession(key, text, pipeline, executor, listener);
        });
    }

    public void change(String uri, String text) {
        session(uri).ifPresentOrElse(session -> session.update(text),
                () -> LOG.warn("Ignoring change of {}, document is not open", uri));
    }

    public void change(String uri, List<TextEdit> edits) {
        session(uri).ifPresentOrElse(session -> session.apply(edits),
                () -> LOG.warn("Ignoring change of {}, document is not open", uri));
    }

    public void close(String uri) {
        DocumentAnalysisSession session = sessions.remove(uri);
        if (session != null) {
            session.close();
        }
    }

    public boolean isOpen(String uri) {
        return sessions.containsKey(uri);
    }

    public Optional<AnalysisSnapshot> snapshot(String uri) {
        return session(uri).flatMap(DocumentAnalysisSession::currentSnapshot);
    }

    /**
     * Snapshot covering every change made to {@code uri} so far.
     */
    public CompletableFuture<AnalysisSnapshot> awaitAnalysis(String uri) {
        return session(uri).map(DocumentAnalysisSession::awaitAnalysis)
                .orElseGet(() -> CompletableFuture.failedFuture(new IllegalStateException(uri + " is not open")));
    }

    public List<Diagnostic> diagnostics(String uri) {
        return query(uri, AnalysisSnapshot::getDiagnostics, List.of());
    }

    public List<CompletionItem> completion(String uri, Position position) {
        return query(uri, snapshot -> queries.completion(snapshot, position), List.of());
    }

    public Optional<HoverInfo> hover(String uri, Position position) {
        return snapshot(uri).flatMap(snapshot -> queries.hover(snapshot, position));
    }

    public Optional<Location> definition(String uri, Position position) {
        return snapshot(uri).flatMap(snapshot -> queries.definition(snapshot, position));
    }

    public List<Location> references(String uri, Position position) {
        return references(uri, position, true);
    }

    public List<Location> references(String uri, Position position, boolean includeDeclaration) {
        return query(uri, snapshot -> queries.references(snapshot, position, includeDeclaration), List.of());
    }

    public List<DocumentSymbol> documentSymbols(String uri) {
        return query(uri, queries::documentSymbols, List.of());
    }

    @Override
    public void close() {
        sessions.values().forEach(DocumentAnalysisSession::close);
        sessions.clear();
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    private Optional<DocumentAnalysisSession> session(String uri) {
        return Optional.ofNullable(sessions.get(uri));
    }

    private <T> T query(String uri, Function<AnalysisSnapshot, T> query, T empty) {
        return snapshot(uri).map(query).orElse(empty);
    }

    private static final class AnalysisThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "jovialframe-analysis-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
