package com.nightscan.output;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MailNotifierTest {

    @TempDir
    Path tempDir;

    @Test
    void sendFailure_shouldWriteBodyWithErrorAndMetrics() throws Exception {
        Mailer.Settings settings = settings();
        MailNotifier notifier = new MailNotifier(new Mailer(fixedClock()), settings);

        notifier.sendFailure("scoring failed: no inputs", document());

        String body = Files.readString(settings.dryRunDir.resolve("mail_20240309_030000.txt"), StandardCharsets.UTF_8);
        assertTrue(body.startsWith("Overnight run failed: scoring failed: no inputs"));
        assertTrue(body.contains("Status: failed"));
        assertTrue(body.contains("stocks_scanned: 8"));
        assertTrue(body.contains("Errors (1):"));
        String eml = Files.readString(settings.dryRunDir.resolve("mail_20240309_030000.eml"), StandardCharsets.UTF_8);
        assertTrue(eml.contains("Subject: [NightScan] Overnight run FAILED 2024-03-08T22:00:00"));
    }

    @Test
    void appendDocument_shouldListOnlyLastMessages() {
        JSONObject doc = document();
        JSONArray warnings = new JSONArray();
        for (int i = 0; i < MailNotifier.MAX_LISTED_MESSAGES + 5; i++) {
            warnings.put(new JSONObject().put("timestamp", "t").put("message", "warning-" + i));
        }
        doc.put("warnings", warnings);
        StringBuilder body = new StringBuilder();

        MailNotifier.appendDocument(body, doc);

        String text = body.toString();
        assertTrue(text.contains("Warnings (15):"));
        assertFalse(text.contains("warning-4\n"));
        assertTrue(text.contains("warning-5\n"));
        assertTrue(text.contains("warning-14\n"));
    }

    @Test
    void sendSuccess_shouldAttachReport() throws Exception {
        Mailer.Settings settings = settings();
        Path report = tempDir.resolve("nightscan_report_20240308.json");
        MailNotifier notifier = new MailNotifier(new Mailer(fixedClock()), settings);

        notifier.sendSuccess(document().put("overall_status", "complete"), report);

        List<String> attachments = Files.readAllLines(
                settings.dryRunDir.resolve("mail_20240309_030000_attachments.txt"), StandardCharsets.UTF_8);
        assertEquals(List.of(report.toString()), attachments);
    }

    private Mailer.Settings settings() {
        Mailer.Settings settings = new Mailer.Settings();
        settings.enabled = true;
        settings.from = "bot@example.com";
        settings.to = List.of("ops@example.com");
        settings.subjectPrefix = "[NightScan]";
        settings.dryRun = true;
        settings.dryRunDir = tempDir.resolve("mail");
        return settings;
    }

    private static Clock fixedClock() {
        return Clock.fixed(Instant.parse("2024-03-09T03:00:00Z"), ZoneOffset.UTC);
    }

    private static JSONObject document() {
        JSONObject doc = new JSONObject();
        doc.put("start_time", "2024-03-08T22:00:00");
        doc.put("overall_status", "failed");
        doc.put("overall_progress", 42.0);
        doc.put("stages", new JSONObject().put("scoring", new JSONObject().put("status", "failed").put("message", "no inputs")));
        doc.put("metrics", new JSONObject().put("stocks_scanned", 8));
        doc.put("errors", new JSONArray().put(new JSONObject().put("timestamp", "t").put("message", "scoring failed")));
        return doc;
    }
}
