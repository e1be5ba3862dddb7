package com.nightscan.predict;

import com.nightscan.core.diagnostics.FeatureResolution;
import org.json.JSONObject;

import java.util.List;

/**
 * Immutable result of start-up capability negotiation. Callers branch on these flags instead of probing models.
 */
public final class BridgeAvailability {
    public final boolean directionModelAvailable;
    public final boolean sentimentAvailable;
    public final boolean newsAvailable;
    public final List<FeatureResolution> resolutions;

    public BridgeAvailability(
            boolean directionModelAvailable,
            boolean sentimentAvailable,
            boolean newsAvailable,
            List<FeatureResolution> resolutions
    ) {
        this.directionModelAvailable = directionModelAvailable;
        this.sentimentAvailable = sentimentAvailable;
        this.newsAvailable = newsAvailable;
        this.resolutions = resolutions == null ? List.of() : List.copyOf(resolutions);
    }

    public static BridgeAvailability baselineOnly() {
        return new BridgeAvailability(false, false, false, List.of());
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("direction_model_available", directionModelAvailable);
        json.put("sentiment_available", sentimentAvailable);
        json.put("news_available", newsAvailable);
        return json;
    }

    @Override
    public String toString() {
        return "direction_model_available=" + directionModelAvailable
                + ", sentiment_available=" + sentimentAvailable
                + ", news_available=" + newsAvailable;
    }
}
