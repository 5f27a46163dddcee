package com.traders.marketstream.backfill;

public interface BackfillProgressListener {

    void onProgress(BackfillProgress progress);

    default void onError(Throwable error) {
    }

    /** Fires once: when the job reports completion or the channel closes underneath the watcher. */
    default void onComplete() {
    }
}
