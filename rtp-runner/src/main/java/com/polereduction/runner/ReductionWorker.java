package com.polereduction.runner;

import com.polereduction.core.filter.ReductionToPole;
import com.polereduction.core.model.FieldGeometry;
import com.polereduction.core.model.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs reductions off the calling thread.
 *
 * <p>
 * Each submission reports {@code 10} percent when it starts, {@code 90} once
 * the reduction is done and {@code 100} after optional mirroring. Failures
 * complete the returned future exceptionally with the original
 * {@link com.polereduction.core.exceptions.ReductionException}.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * The worker owns a single daemon thread. {@link #close()} stops accepting
 * work and waits briefly for running reductions to finish.
 * </p>
 *
 * @since 1.0.0
 */
public class ReductionWorker implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ReductionWorker.class);

    static final int PROGRESS_STARTED = 10;
    static final int PROGRESS_REDUCED = 90;
    static final int PROGRESS_DONE = 100;

    private final ReductionToPole reduction;
    private final ExecutorService executor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param reduction the pipeline to run; must not be {@code null}
     */
    public ReductionWorker(ReductionToPole reduction) {
        this.reduction = Objects.requireNonNull(reduction, "ReductionToPole must not be null");
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "rtp-worker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Submit one profile for reduction.
     *
     * @param profile  the measured profile
     * @param dx       sampling interval (m)
     * @param geometry field and profile directions
     * @param mirror   negate the result before completing
     * @param listener progress callback; {@link ProgressListener#NONE} to
     *                 ignore
     * @return future holding the reduced anomaly
     * @throws IllegalStateException if the worker is closed
     */
    public CompletableFuture<double[]> submit(Profile profile, double dx, FieldGeometry geometry,
            boolean mirror, ProgressListener listener) {
        Objects.requireNonNull(listener, "ProgressListener must not be null");
        if (closed.get()) {
            throw new IllegalStateException("ReductionWorker is closed");
        }
        return CompletableFuture.supplyAsync(() -> {
            listener.onProgress(PROGRESS_STARTED);
            double[] reduced = reduction.reduce(profile, dx, geometry);
            listener.onProgress(PROGRESS_REDUCED);
            double[] result = mirror ? ReductionToPole.mirror(reduced) : reduced;
            listener.onProgress(PROGRESS_DONE);
            LOG.info("Reduced {} samples (mirror={})", result.length, mirror);
            return result;
        }, executor);
    }

    /**
     * @return {@code true} once {@link #close()} has been called
     */
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Reduction worker did not stop in time; interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.debug("Reduction worker stopped");
    }
}
