package com.cypher.bridge.bulk;

/**
 * Callback for tracking progress of file loading.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed statements processed so far in the current source
     * @param total     statements in the current source, or -1 if unknown
     * @param message   short progress message
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
