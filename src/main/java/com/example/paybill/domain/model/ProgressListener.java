package com.example.paybill.domain.model;

/**
 * Optional synchronous progress callback.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (phase, detail) -> {
    };

    void onProgress(ProcessingPhase phase, String detail);

    static ProgressListener orNone(ProgressListener listener) {
        return listener == null ? NONE : listener;
    }
}
