package com.nightscan.output;

import com.nightscan.model.RegimeResult;
import com.nightscan.predict.BridgeAvailability;
import com.nightscan.scoring.ScoringSummary;
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

class RunReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void write_shouldProduceDatedJsonReport() throws Exception {
        RunReportWriter writer = new RunReportWriter(tempDir.resolve("reports"));
        LocalDate runDate = LocalDate.of(2024, 3, 8);
        RegimeResult regime = RegimeResult.insufficient("too few rows", runDate.minusDays(90), runDate, 12);

        Path report = writer.write(runDate, regime, BridgeAvailability.baselineOnly(),
                new ScoringSummary(0, 0, 0, 0, 0.0), List.of(),
                Map.of("bad.us", "FETCH_FAILED: http 404"),
                List.of(tempDir.resolve("factor_view_stocks_20240308.csv")));

        assertEquals("nightscan_report_20240308.json", report.getFileName().toString());
        JSONObject json = new JSONObject(Files.readString(report, StandardCharsets.UTF_8));
        assertEquals("2024-03-08", json.getString("run_date"));
        assertEquals("FETCH_FAILED: http 404", json.getJSONObject("skipped_symbols").getString("bad.us"));
        assertEquals(0, json.getJSONArray("top_opportunities").length());
        assertEquals(1, json.getJSONArray("factor_view_files").length());
        assertEquals("unknown", json.getJSONObject("regime").getString("regime_label"));
        assertEquals("too few rows", json.getJSONObject("regime").getString("warning"));
    }

    @Test
    void write_shouldAcceptMissingRegime() throws Exception {
        RunReportWriter writer = new RunReportWriter(tempDir);

        Path report = writer.write(LocalDate.of(2024, 3, 8), null, null, null, List.of(), Map.of(), List.of());

        JSONObject json = new JSONObject(Files.readString(report, StandardCharsets.UTF_8));
        assertTrue(json.isNull("regime"));
        assertTrue(json.isNull("summary"));
    }
}
