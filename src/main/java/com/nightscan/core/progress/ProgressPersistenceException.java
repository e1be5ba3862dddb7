package com.nightscan.core.progress;

import com.nightscan.core.PipelineStageException;

/**
 * The progress document could not be written or read back.
 */
public class ProgressPersistenceException extends PipelineStageException {

    public ProgressPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
