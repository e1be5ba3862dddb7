package com.nightscan.output;

import org.json.JSONObject;

import java.nio.file.Path;

/**
 * Channel told once when a run reaches its terminal state.
 */
public interface PipelineNotifier {

    /**
     * @param reportPath report produced by the run, may be null
     */
    void sendSuccess(JSONObject progressDocument, Path reportPath);

    void sendFailure(String errorMessage, JSONObject progressDocument);
}
