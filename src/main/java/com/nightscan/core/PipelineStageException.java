package com.nightscan.core;

/**
 * Unrecoverable failure of a pipeline stage. Marks the stage and the whole run failed.
 */
public class PipelineStageException extends RuntimeException {

    public PipelineStageException(String message) {
        super(message);
    }

    public PipelineStageException(String message, Throwable cause) {
        super(message, cause);
    }
}
