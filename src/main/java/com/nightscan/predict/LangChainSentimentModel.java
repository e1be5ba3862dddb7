package com.nightscan.predict;

import com.nightscan.config.Config;
import com.nightscan.model.NewsItem;
import com.nightscan.model.SentimentReading;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Labels a symbol's recent headlines using LangChain4j + Ollama.
 */
public final class LangChainSentimentModel implements SentimentModel {
    private static final Logger LOG = LogManager.getLogger(LangChainSentimentModel.class);
    static final int MAX_HEADLINES = 20;

    private final ChatLanguageModel chatModel;
    private final String initError;

    public LangChainSentimentModel(Config config) {
        ChatLanguageModel built;
        String error = null;
        try {
            built = OllamaChatModel.builder()
                    .baseUrl(config.getString("ai.base_url", "http://127.0.0.1:11434"))
                    .modelName(config.getString("ai.model", "llama3.1:latest"))
                    .temperature(config.getDouble("ai.temperature", 0.0))
                    .timeout(Duration.ofSeconds(Math.max(10, config.getInt("ai.timeout_sec", 120))))
                    .build();
        } catch (RuntimeException e) {
            LOG.warn("Failed to initialize LangChain4j Ollama model: {}", e.getMessage());
            built = null;
            error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        }
        this.chatModel = built;
        this.initError = error;
    }

    LangChainSentimentModel(ChatLanguageModel chatModel) {
        this.chatModel = chatModel;
        this.initError = chatModel == null ? "chat model missing" : null;
    }

    @Override
    public String initError() {
        return initError;
    }

    @Override
    public SentimentReading analyze(String symbol, List<NewsItem> news) throws ModelUnavailableException {
        if (news == null || news.isEmpty()) {
            return SentimentReading.noSignal();
        }
        if (chatModel == null) {
            throw new ModelUnavailableException("sentiment model not initialised: " + initError);
        }
        List<NewsItem> used = news.size() > MAX_HEADLINES ? news.subList(0, MAX_HEADLINES) : news;
        String out;
        try {
            out = chatModel.generate(buildPrompt(symbol, used));
        } catch (RuntimeException e) {
            throw new ModelUnavailableException("sentiment call failed for " + symbol + ": " + e.getMessage(), e);
        }
        return parseReply(out, used);
    }

    static SentimentReading parseReply(String reply, List<NewsItem> used) throws ModelUnavailableException {
        String body = extractJson(reply);
        if (body.isEmpty()) {
            throw new ModelUnavailableException("sentiment reply has no JSON object");
        }
        try {
            JSONObject json = new JSONObject(body);
            String label = json.optString("label", "neutral").trim().toLowerCase(Locale.ROOT);
            double score = json.optDouble("score", Double.NaN);
            double confidence = json.optDouble("confidence", Double.NaN);
            if (!Double.isFinite(score)) {
                score = scoreForLabel(label);
            }
            if (!Double.isFinite(confidence)) {
                throw new ModelUnavailableException("sentiment reply missing confidence");
            }
            double confidencePct = confidence <= 1.0 ? confidence * 100.0 : confidence;
            return new SentimentReading(normalizeLabel(label, score), confidencePct, score, used.size(), sources(used));
        } catch (JSONException e) {
            throw new ModelUnavailableException("sentiment reply is not valid JSON: " + e.getMessage(), e);
        }
    }

    private String buildPrompt(String symbol, List<NewsItem> news) {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("You are an equity news analyst.\n");
        sb.append("Rate the overall sentiment of the following headlines for the stock ").append(symbol).append(".\n");
        sb.append("Rules:\n");
        sb.append("1) Reply with a single JSON object and nothing else.\n");
        sb.append("2) Keys: \"label\" (positive, negative or neutral), \"score\" (number from -1 to 1), ");
        sb.append("\"confidence\" (number from 0 to 1).\n");
        sb.append("3) Judge only from the headlines given.\n\n");
        sb.append("Headlines:\n");
        int idx = 1;
        for (NewsItem item : news) {
            sb.append(idx++).append(") ").append(item.title);
            if (!item.source.isEmpty()) {
                sb.append(" [").append(item.source).append("]");
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    private static String extractJson(String reply) {
        if (reply == null) {
            return "";
        }
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return "";
        }
        return reply.substring(start, end + 1);
    }

    private static double scoreForLabel(String label) {
        if (label.startsWith("pos")) {
            return 0.5;
        }
        if (label.startsWith("neg")) {
            return -0.5;
        }
        return 0.0;
    }

    private static String normalizeLabel(String label, double score) {
        if (label.startsWith("pos")) {
            return "positive";
        }
        if (label.startsWith("neg")) {
            return "negative";
        }
        if (label.startsWith("neu")) {
            return "neutral";
        }
        return score > 0.1 ? "positive" : score < -0.1 ? "negative" : "neutral";
    }

    private static List<String> sources(List<NewsItem> news) {
        Set<String> out = new LinkedHashSet<>();
        for (NewsItem item : news) {
            if (!item.source.isEmpty()) {
                out.add(item.source);
            }
        }
        return new ArrayList<>(out);
    }
}
