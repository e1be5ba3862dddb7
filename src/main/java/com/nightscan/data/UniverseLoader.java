package com.nightscan.data;

import com.nightscan.model.StockCandidate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the stock universe from a CSV file with header {@code symbol,name,sector}.
 * Blank lines and lines starting with {@code #} are ignored; a repeated symbol keeps its first row.
 */
public final class UniverseLoader {

    public List<StockCandidate> load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("universe file not found: " + path.toAbsolutePath());
        }
        return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    static List<StockCandidate> parse(List<String> lines) {
        Map<String, StockCandidate> bySymbol = new LinkedHashMap<>();
        boolean headerSeen = false;
        for (String raw : lines) {
            String line = raw == null ? "" : raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] cols = line.split(",", -1);
            if (!headerSeen) {
                headerSeen = true;
                if (cols[0].trim().toLowerCase(Locale.ROOT).equals("symbol")) {
                    continue;
                }
            }
            String symbol = cols[0].trim();
            if (symbol.isEmpty()) {
                continue;
            }
            String name = cols.length > 1 ? cols[1] : "";
            String sector = cols.length > 2 ? cols[2] : "";
            bySymbol.putIfAbsent(symbol.toUpperCase(Locale.ROOT), new StockCandidate(symbol, name, sector));
        }
        return new ArrayList<>(bySymbol.values());
    }
}
