package com.nightscan.output;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.nio.file.Path;

/**
 * Writes the run outcome to the application log.
 */
public final class LogNotifier implements PipelineNotifier {
    private static final Logger LOG = LogManager.getLogger(LogNotifier.class);

    @Override
    public void sendSuccess(JSONObject progressDocument, Path reportPath) {
        LOG.info("Pipeline complete in {} report={} metrics={}",
                progressDocument.optString("execution_time_formatted", "-"),
                reportPath == null ? "-" : reportPath,
                progressDocument.optJSONObject("metrics"));
    }

    @Override
    public void sendFailure(String errorMessage, JSONObject progressDocument) {
        LOG.error("Pipeline failed after {}: {} (errors={}, warnings={})",
                progressDocument.optString("execution_time_formatted", "-"),
                errorMessage,
                progressDocument.optJSONArray("errors") == null ? 0 : progressDocument.getJSONArray("errors").length(),
                progressDocument.optJSONArray("warnings") == null ? 0 : progressDocument.getJSONArray("warnings").length());
    }
}
