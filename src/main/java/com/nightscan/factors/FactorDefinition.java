package com.nightscan.factors;

import java.util.ArrayList;
import java.util.List;

/**
 * A macro factor: display name and the symbol whose returns proxy it.
 */
public final class FactorDefinition {
    public final String name;
    public final String symbol;

    public FactorDefinition(String name, String symbol) {
        if (name == null || name.isBlank() || symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("factor needs a name and a symbol: " + name + ":" + symbol);
        }
        this.name = name.trim();
        this.symbol = symbol.trim();
    }

    /**
     * Parses {@code name:symbol} tokens.
     */
    public static List<FactorDefinition> parse(List<String> tokens) {
        List<FactorDefinition> out = new ArrayList<>();
        for (String token : tokens) {
            int sep = token.indexOf(':');
            if (sep <= 0 || sep == token.length() - 1) {
                throw new IllegalArgumentException("factor must be name:symbol, got " + token);
            }
            out.add(new FactorDefinition(token.substring(0, sep), token.substring(sep + 1)));
        }
        return out;
    }

    @Override
    public String toString() {
        return name + ":" + symbol;
    }
}
