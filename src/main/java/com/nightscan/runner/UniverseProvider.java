package com.nightscan.runner;

import com.nightscan.model.StockCandidate;

import java.io.IOException;
import java.util.List;

@FunctionalInterface
public interface UniverseProvider {

    List<StockCandidate> load() throws IOException;
}
