package com.nightscan.output;

import com.nightscan.core.PipelineStageException;
import jakarta.mail.MessagingException;
import org.json.JSONArray;
import org.json.JSONObject;

import java.nio.file.Path;
import java.util.List;

/**
 * 模块说明：MailNotifier（class）。
 * 主要职责：运行结束时发送纯文本邮件，正文包含整体状态、阶段、指标与最近错误；成功时附带报告文件。
 * 使用建议：mail.fail_fast=true 时发送失败会抛出 PipelineStageException，否则只记录告警。
 */
public final class MailNotifier implements PipelineNotifier {
    static final int MAX_LISTED_MESSAGES = 10;

    private final Mailer mailer;
    private final Mailer.Settings settings;

    public MailNotifier(Mailer mailer, Mailer.Settings settings) {
        this.mailer = mailer;
        this.settings = settings;
    }

    @Override
    public void sendSuccess(JSONObject progressDocument, Path reportPath) {
        String subject = "Overnight run complete " + progressDocument.optString("start_time", "");
        StringBuilder body = new StringBuilder(1024);
        body.append("Overnight run complete.\n");
        if (reportPath != null) {
            body.append("Report: ").append(reportPath).append('\n');
        }
        appendDocument(body, progressDocument);
        send(subject, body.toString(), reportPath == null ? List.of() : List.of(reportPath));
    }

    @Override
    public void sendFailure(String errorMessage, JSONObject progressDocument) {
        String subject = "Overnight run FAILED " + progressDocument.optString("start_time", "");
        StringBuilder body = new StringBuilder(1024);
        body.append("Overnight run failed: ").append(errorMessage).append('\n');
        appendDocument(body, progressDocument);
        send(subject, body.toString(), List.of());
    }

    static void appendDocument(StringBuilder body, JSONObject doc) {
        body.append('\n');
        body.append("Status: ").append(doc.optString("overall_status", "-"))
                .append(" (").append(doc.optDouble("overall_progress", 0.0)).append("%)\n");
        body.append("Started: ").append(doc.optString("start_time", "-"))
                .append("  Finished: ").append(doc.optString("end_time", "-"))
                .append("  Elapsed: ").append(doc.optString("execution_time_formatted", "-")).append('\n');
        JSONObject stages = doc.optJSONObject("stages");
        if (stages != null) {
            body.append("\nStages:\n");
            for (String name : stages.keySet()) {
                JSONObject stage = stages.getJSONObject(name);
                body.append("  ").append(name).append(": ").append(stage.optString("status"))
                        .append(' ').append(stage.optString("message")).append('\n');
            }
        }
        JSONObject metrics = doc.optJSONObject("metrics");
        if (metrics != null) {
            body.append("\nMetrics:\n");
            for (String name : metrics.keySet()) {
                body.append("  ").append(name).append(": ").append(metrics.opt(name)).append('\n');
            }
        }
        appendMessages(body, "Errors", doc.optJSONArray("errors"));
        appendMessages(body, "Warnings", doc.optJSONArray("warnings"));
    }

    private static void appendMessages(StringBuilder body, String title, JSONArray messages) {
        if (messages == null || messages.isEmpty()) {
            return;
        }
        body.append('\n').append(title).append(" (").append(messages.length()).append("):\n");
        int start = Math.max(0, messages.length() - MAX_LISTED_MESSAGES);
        for (int i = start; i < messages.length(); i++) {
            JSONObject entry = messages.getJSONObject(i);
            body.append("  ").append(entry.optString("timestamp")).append(' ').append(entry.optString("message")).append('\n');
        }
    }

    private void send(String subject, String body, List<Path> attachments) {
        try {
            mailer.send(settings, subject, body, attachments);
        } catch (MessagingException e) {
            throw new PipelineStageException("mail notification failed: " + e.getMessage(), e);
        }
    }
}
