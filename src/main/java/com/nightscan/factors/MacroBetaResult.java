package com.nightscan.factors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * symbol → factor → beta for every defined pair, plus the reason each omitted pair or symbol was left out.
 */
public final class MacroBetaResult {
    private final List<String> factorNames;
    private final Map<String, Map<String, Double>> betas;
    private final Map<String, String> missing;

    MacroBetaResult(List<String> factorNames, Map<String, Map<String, Double>> betas, Map<String, String> missing) {
        this.factorNames = List.copyOf(factorNames);
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Double>> entry : betas.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
        }
        this.betas = Collections.unmodifiableMap(copy);
        this.missing = Collections.unmodifiableMap(new LinkedHashMap<>(missing));
    }

    public List<String> factorNames() {
        return factorNames;
    }

    public Map<String, Map<String, Double>> betas() {
        return betas;
    }

    /**
     * Betas for one symbol; empty when none could be computed.
     */
    public Map<String, Double> betasFor(String symbol) {
        Map<String, Double> out = betas.get(symbol);
        return out == null ? Map.of() : out;
    }

    public OptionalDouble beta(String symbol, String factor) {
        Double value = betasFor(symbol).get(factor);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * Keys are a symbol, or {@code symbol/factor} for a single omitted pair.
     */
    public Map<String, String> missing() {
        return missing;
    }
}
