package com.nightscan.scoring;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FactorViewExporterTest {

    @TempDir
    Path tempDir;

    @Test
    void export_shouldWriteThreeDatedFiles() throws Exception {
        FactorView view = FactorViewBuilder.build(FactorViewBuilderTest.scoredBatch(), List.of("market"));
        FactorViewExporter exporter = new FactorViewExporter(tempDir.resolve("reports"));

        FactorViewExporter.ExportedFiles files = exporter.export(view, LocalDate.of(2024, 3, 8));

        assertEquals("factor_view_stocks_20240308.csv", files.stocks.getFileName().toString());
        assertEquals("factor_view_sectors_20240308.csv", files.sectors.getFileName().toString());
        assertEquals("factor_view_summary_20240308.json", files.summary.getFileName().toString());
        for (Path path : files.all()) {
            assertTrue(Files.isRegularFile(path), path.toString());
        }
        List<String> stockLines = Files.readAllLines(files.stocks, StandardCharsets.UTF_8);
        assertEquals(4, stockLines.size());
        assertTrue(stockLines.get(0).startsWith("symbol,name,sector,opportunity_score,prediction_confidence"));
        assertTrue(stockLines.get(0).endsWith("beta_market,prediction,confidence_pct"));
        String summary = Files.readString(files.summary, StandardCharsets.UTF_8);
        assertTrue(summary.contains("\"total_stocks\": 3"));
    }

    @Test
    void sectorsCsv_shouldListSectorsAlphabetically() {
        FactorView view = FactorViewBuilder.build(FactorViewBuilderTest.scoredBatch(), List.of("market"));

        String[] lines = FactorViewExporter.sectorsCsv(view).split("\n");

        assertEquals("sector,count,avg_opportunity_score,avg_beta_market,buy_count,sell_count", lines[0]);
        assertTrue(lines[1].startsWith("Energy,1,"));
        assertTrue(lines[2].startsWith("Tech,2,"));
        assertTrue(lines[1].endsWith(",1.1000,0,1"));
    }

    @Test
    void stocksCsv_shouldQuoteNamesContainingCommas() {
        FactorViewRow row = new FactorViewRow("brk.us", "Berkshire, Inc.", "Financials", 70.0,
                Map.of(), 70.0, 0.0, 0, 0, Map.of(), "HOLD", 50.0);
        FactorView view = new FactorView(List.of(), List.of(row), List.of(), new JSONObject());

        String csv = FactorViewExporter.stocksCsv(view);

        assertTrue(csv.contains("brk.us,\"Berkshire, Inc.\",Financials,70.0000"));
    }
}
