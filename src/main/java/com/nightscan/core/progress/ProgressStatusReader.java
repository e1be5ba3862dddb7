package com.nightscan.core.progress;

import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only status surface over the progress store. Never writes.
 */
public final class ProgressStatusReader {
    private final ProgressStore store;

    public ProgressStatusReader(ProgressStore store) {
        this.store = store;
    }

    public Optional<ProgressSnapshot> read() {
        return store.read().map(ProgressSnapshot::fromJson);
    }

    public List<ProgressSnapshot> history(int limit) {
        List<ProgressSnapshot> out = new ArrayList<>();
        for (JSONObject doc : store.history(limit)) {
            out.add(ProgressSnapshot.fromJson(doc));
        }
        return out;
    }
}
