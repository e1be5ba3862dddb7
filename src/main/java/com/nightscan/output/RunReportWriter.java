package com.nightscan.output;

import com.nightscan.config.Config;
import com.nightscan.model.RegimeResult;
import com.nightscan.model.ScoredOpportunity;
import com.nightscan.predict.BridgeAvailability;
import com.nightscan.scoring.ScoringSummary;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * 模块说明：RunReportWriter（class）。
 * 主要职责：把一次运行的结果（市场状态、模型可用性、评分汇总、入选机会、被跳过的标的）写成 JSON 报告。
 * 使用建议：报告路径会写入进度文档并随成功通知发送。
 */
public final class RunReportWriter {
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final Path reportDir;

    public RunReportWriter(Config config) {
        this(config.getPath("report.dir"));
    }

    public RunReportWriter(Path reportDir) {
        this.reportDir = reportDir;
    }

    public Path write(
            LocalDate runDate,
            RegimeResult regime,
            BridgeAvailability availability,
            ScoringSummary summary,
            List<ScoredOpportunity> top,
            Map<String, String> skipped,
            List<Path> factorFiles
    ) throws IOException {
        Files.createDirectories(reportDir);
        Path out = reportDir.resolve("nightscan_report_" + runDate.format(FILE_DATE) + ".json");
        JSONObject json = new JSONObject();
        json.put("run_date", runDate.toString());
        json.put("regime", regime == null ? JSONObject.NULL : regime.toJson());
        json.put("availability", availability == null ? JSONObject.NULL : availability.toJson());
        json.put("summary", summary == null ? JSONObject.NULL : summary.toJson());
        JSONArray opportunities = new JSONArray();
        for (ScoredOpportunity opportunity : top) {
            opportunities.put(opportunity.toJson());
        }
        json.put("top_opportunities", opportunities);
        json.put("skipped_symbols", new JSONObject(skipped));
        JSONArray files = new JSONArray();
        for (Path file : factorFiles) {
            files.put(file.toString());
        }
        json.put("factor_view_files", files);
        Files.writeString(out, json.toString(2), StandardCharsets.UTF_8);
        return out;
    }
}
