package com.postal.directory.bulk;

/**
 * Callback interface for tracking progress of source loading.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called to report progress.
     *
     * @param processed the number of records parsed so far
     * @param total     the total number of records (-1 while still unknown)
     * @param message   progress message
     */
    void onProgress(long processed, long total, String message);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = (processed, total, message) -> {};
}
