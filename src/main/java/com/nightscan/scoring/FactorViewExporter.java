package com.nightscan.scoring;

import com.nightscan.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Writes a factor view as stock CSV, sector CSV and summary JSON under the reports directory, keyed by run date.
 */
public final class FactorViewExporter {
    private static final Logger LOG = LogManager.getLogger(FactorViewExporter.class);
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final Path reportDir;

    public FactorViewExporter(Config config) {
        this(config.getPath("report.dir"));
    }

    public FactorViewExporter(Path reportDir) {
        this.reportDir = reportDir;
    }

    public ExportedFiles export(FactorView view, LocalDate runDate) throws IOException {
        Files.createDirectories(reportDir);
        String stamp = runDate.format(FILE_DATE);
        Path stocks = reportDir.resolve("factor_view_stocks_" + stamp + ".csv");
        Path sectors = reportDir.resolve("factor_view_sectors_" + stamp + ".csv");
        Path summary = reportDir.resolve("factor_view_summary_" + stamp + ".json");

        Files.writeString(stocks, stocksCsv(view), StandardCharsets.UTF_8);
        Files.writeString(sectors, sectorsCsv(view), StandardCharsets.UTF_8);
        Files.writeString(summary, view.summary.toString(2), StandardCharsets.UTF_8);
        LOG.info("Factor view exported rows={} sectors={} dir={}", view.rows.size(), view.sectors.size(), reportDir);
        return new ExportedFiles(stocks, sectors, summary);
    }

    static String stocksCsv(FactorView view) {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("symbol,name,sector,opportunity_score");
        for (String name : FactorViewBuilder.SUB_SCORES) {
            sb.append(',').append(name);
        }
        sb.append(",base_total,total_adjustment,penalty_count,bonus_count");
        for (String factor : view.factorNames) {
            sb.append(",beta_").append(factor);
        }
        sb.append(",prediction,confidence_pct\n");
        for (FactorViewRow row : view.rows) {
            sb.append(csv(row.symbol)).append(',').append(csv(row.name)).append(',').append(csv(row.sector))
                    .append(',').append(num(row.opportunityScore));
            for (String name : FactorViewBuilder.SUB_SCORES) {
                sb.append(',').append(num(row.subScores.getOrDefault(name, 0.0)));
            }
            sb.append(',').append(num(row.baseTotal))
                    .append(',').append(num(row.totalAdjustment))
                    .append(',').append(row.penaltyCount)
                    .append(',').append(row.bonusCount);
            for (String factor : view.factorNames) {
                sb.append(',').append(num(row.beta(factor)));
            }
            sb.append(',').append(row.prediction).append(',').append(num(row.confidencePct)).append('\n');
        }
        return sb.toString();
    }

    static String sectorsCsv(FactorView view) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("sector,count,avg_opportunity_score");
        for (String factor : view.factorNames) {
            sb.append(",avg_beta_").append(factor);
        }
        sb.append(",buy_count,sell_count\n");
        for (SectorSummary s : view.sectors) {
            sb.append(csv(s.sector)).append(',').append(s.count).append(',').append(num(s.avgOpportunityScore));
            for (String factor : view.factorNames) {
                sb.append(',').append(num(s.avgBetas.getOrDefault(factor, 0.0)));
            }
            sb.append(',').append(s.buyCount).append(',').append(s.sellCount).append('\n');
        }
        return sb.toString();
    }

    private static String num(double value) {
        return String.format(Locale.US, "%.4f", value);
    }

    private static String csv(String value) {
        String v = value == null ? "" : value;
        if (v.contains(",") || v.contains("\"") || v.contains("\n")) {
            return "\"" + v.replace("\"", "\"\"") + "\"";
        }
        return v;
    }

    public static final class ExportedFiles {
        public final Path stocks;
        public final Path sectors;
        public final Path summary;

        ExportedFiles(Path stocks, Path sectors, Path summary) {
            this.stocks = stocks;
            this.sectors = sectors;
            this.summary = summary;
        }

        public List<Path> all() {
            return List.of(stocks, sectors, summary);
        }
    }
}
