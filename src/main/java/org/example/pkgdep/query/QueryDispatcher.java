package org.example.pkgdep.query;

import org.example.pkgdep.graph.CycleDetector;
import org.example.pkgdep.graph.DependencyGraphBuilder;
import org.example.pkgdep.model.PackageName;
import org.example.pkgdep.render.QueryReport;
import org.example.pkgdep.render.ResultRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs queries off the caller's thread and hands rendered results back.
 *
 * <p>Every query gets its own task on the worker pool and builds its own
 * traversal state, so queries share nothing. Results are delivered through the
 * returned future and, optionally, to a listener on a caller-chosen executor
 * (the presentation thread). There is no cancellation and no ordering between
 * concurrent queries: a slower earlier query may deliver after a later one.</p>
 */
public class QueryDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QueryDispatcher.class);

    private final DependencyGraphBuilder graphBuilder;
    private final CycleDetector cycleDetector;
    private final ResultRenderer renderer;
    private final ExecutorService workers;

    public QueryDispatcher(DependencyGraphBuilder graphBuilder, CycleDetector cycleDetector, ResultRenderer renderer) {
        this(graphBuilder, cycleDetector, renderer, Executors.newCachedThreadPool(new QueryThreadFactory()));
    }

    public QueryDispatcher(DependencyGraphBuilder graphBuilder, CycleDetector cycleDetector,
                           ResultRenderer renderer, ExecutorService workers) {
        this.graphBuilder = Objects.requireNonNull(graphBuilder, "graphBuilder cannot be null");
        this.cycleDetector = Objects.requireNonNull(cycleDetector, "cycleDetector cannot be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer cannot be null");
        this.workers = Objects.requireNonNull(workers, "workers cannot be null");
    }

    /**
     * Submits a query.
     *
     * @param type        which query to run
     * @param packageName raw package name as typed by the user
     * @return the pending report, or empty if the name is blank (nothing is run)
     */
    public Optional<CompletableFuture<QueryReport>> submit(QueryType type, String packageName) {
        Objects.requireNonNull(type, "type cannot be null");
        if (PackageName.isBlank(packageName)) {
            log.debug("Ignoring {} query for blank package name", type.getId());
            return Optional.empty();
        }

        PackageName root = PackageName.of(packageName);
        CompletableFuture<QueryReport> future = CompletableFuture.supplyAsync(() -> execute(type, root), workers);
        future.whenComplete((report, error) -> {
            if (error != null) {
                log.error("{} query for {} failed", type.getId(), root, error);
            }
        });
        return Optional.of(future);
    }

    /**
     * Submits a query and delivers its report to a listener on the given executor.
     *
     * @param type             which query to run
     * @param packageName      raw package name as typed by the user
     * @param deliveryExecutor executor owning presentation state
     * @param listener         receives the report on {@code deliveryExecutor}
     * @return the pending delivery, or empty if the name is blank (nothing is run)
     */
    public Optional<CompletableFuture<Void>> submit(QueryType type, String packageName,
                                                    Executor deliveryExecutor, Consumer<QueryReport> listener) {
        Objects.requireNonNull(deliveryExecutor, "deliveryExecutor cannot be null");
        Objects.requireNonNull(listener, "listener cannot be null");
        return submit(type, packageName)
                .map(future -> future.thenAcceptAsync(listener, deliveryExecutor));
    }

    /**
     * Runs a query on the calling thread.
     */
    public QueryReport execute(QueryType type, PackageName root) {
        switch (type) {
            case DEPENDENCIES:
                return renderer.render(graphBuilder.buildDependencyView(root));
            case REVERSE:
                return renderer.render(graphBuilder.buildReverseView(root));
            case CYCLES:
                return renderer.render(cycleDetector.findCycles(root));
            default:
                throw new IllegalArgumentException("Unsupported query type: " + type);
        }
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static class QueryThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "pkgdep-query-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
