package com.example.rentroll.domain.model;

/**
 * Callback hooks for callers that want to report progress while a workbook is processed.
 */
public interface ProcessingListener {

    /**
     * Listener that ignores every event.
     */
    ProcessingListener NONE = new ProcessingListener() {
    };

    /**
     * Invoked when a stage begins.
     *
     * @param stage stage about to run
     */
    default void onStage(ProcessingStage stage) {
    }

    /**
     * Invoked once the processed workbook has been serialized.
     *
     * @param result summary of the finished run
     */
    default void onCompleted(ProcessingResult result) {
    }
}
