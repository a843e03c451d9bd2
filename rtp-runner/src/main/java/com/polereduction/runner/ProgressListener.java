package com.polereduction.runner;

/**
 * Receives coarse progress updates from a {@link ReductionWorker}.
 *
 * <p>
 * Called on the worker thread; implementations must not block.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProgressListener {

    /** Listener that ignores every update. */
    ProgressListener NONE = percent -> {
    };

    /**
     * @param percent completion in {@code [0, 100]}
     */
    void onProgress(int percent);
}
