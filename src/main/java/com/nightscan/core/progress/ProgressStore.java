package com.nightscan.core.progress;

import org.json.JSONObject;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of the progress document. Every write replaces the whole document.
 */
public interface ProgressStore {

    void write(JSONObject document);

    /**
     * Stores the final document under the history location, keyed by the run's start time.
     */
    void archive(JSONObject document, LocalDateTime startTime);

    Optional<JSONObject> read();

    /**
     * Archived documents, newest first.
     */
    List<JSONObject> history(int limit);
}
