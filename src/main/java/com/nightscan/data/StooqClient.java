package com.nightscan.data;

import com.nightscan.config.Config;
import com.nightscan.model.PriceBar;
import com.nightscan.model.PriceSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Stooq daily CSV client with retries, request pacing and a timeout circuit breaker.
 */
public final class StooqClient implements MarketDataService {
    private static final Logger LOG = LogManager.getLogger(StooqClient.class);
    private static final DateTimeFormatter STOOQ_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final String baseUrl;
    private final int timeoutSec;
    private final int retryCount;
    private final long retrySleepMs;
    private final long requestPauseMs;
    private final int timeoutStreakThreshold;
    private final long circuitCooldownMs;
    private final HttpClient httpClient;
    private final AtomicLong lastRequestAtNanos = new AtomicLong(0L);
    private final AtomicInteger timeoutStreak = new AtomicInteger(0);
    private final AtomicLong circuitOpenUntilNanos = new AtomicLong(0L);

    public StooqClient(Config config) {
        this.baseUrl = config.getString("stooq.base_url");
        this.timeoutSec = Math.max(3, config.getInt("stooq.request_timeout_sec", 20));
        this.retryCount = Math.max(0, config.getInt("stooq.retry_count", 2));
        this.retrySleepMs = Math.max(100L, config.getLong("stooq.retry_sleep_ms", 700L));
        this.requestPauseMs = Math.max(0L, config.getLong("stooq.request_pause_ms", 0L));
        this.timeoutStreakThreshold = Math.max(1, config.getInt("stooq.circuit_breaker.timeout_streak", 10));
        this.circuitCooldownMs = Math.max(0L, config.getLong("stooq.circuit_breaker.cooldown_sec", 60L) * 1000L);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(timeoutSec))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public PriceSeries fetch(String symbol, LocalDate start, LocalDate end) throws FetchException {
        String normalized = symbol == null ? "" : symbol.toLowerCase(Locale.ROOT).trim();
        if (normalized.isEmpty()) {
            throw new FetchException(symbol, "no_data: blank symbol");
        }
        String lastError = "";
        for (int attempt = 0; attempt <= retryCount; attempt++) {
            try {
                String url = String.format(baseUrl, normalized, STOOQ_DATE.format(start), STOOQ_DATE.format(end));
                waitIfCircuitOpen();
                throttleRequest(requestPauseMs);
                HttpRequest request = HttpRequest.newBuilder()
                        .uri(URI.create(url))
                        .header("User-Agent", "nightscan/1.0")
                        .timeout(Duration.ofSeconds(timeoutSec))
                        .GET()
                        .build();
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() / 100 != 2) {
                    throw new IllegalStateException("stooq http status=" + response.statusCode() + " symbol=" + symbol);
                }
                List<PriceBar> bars = parseCsv(symbol, response.body());
                onRequestResult(true, "");
                PriceSeries series = PriceSeries.sorted(symbol, bars).since(start);
                if (series.isEmpty()) {
                    throw new FetchException(symbol, "no_data: stooq returned no bars for " + symbol);
                }
                return series;
            } catch (FetchException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException(symbol, "stooq_fetch_interrupted", e);
            } catch (Exception e) {
                lastError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                onRequestResult(false, FetchException.classify(lastError));
                if (attempt >= retryCount || !isRetryable(lastError)) {
                    break;
                }
                LOG.debug("stooq retry symbol={} attempt={} err={}", symbol, attempt + 1, lastError);
                try {
                    Thread.sleep(retrySleepMs * (attempt + 1));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new FetchException(symbol, "stooq_fetch_interrupted", ie);
                }
            }
        }
        throw new FetchException(symbol, lastError.isEmpty() ? "stooq_fetch_failed" : lastError);
    }

    private void onRequestResult(boolean success, String failureCategory) {
        if (success || !"timeout".equals(failureCategory)) {
            timeoutStreak.set(0);
            return;
        }
        int streak = timeoutStreak.incrementAndGet();
        if (streak < timeoutStreakThreshold || circuitCooldownMs <= 0L) {
            return;
        }
        timeoutStreak.set(0);
        openCircuitCooldown();
    }

    private void openCircuitCooldown() {
        long openUntil = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(circuitCooldownMs);
        while (true) {
            long prev = circuitOpenUntilNanos.get();
            long next = Math.max(prev, openUntil);
            if (circuitOpenUntilNanos.compareAndSet(prev, next)) {
                if (next > prev) {
                    LOG.warn("Stooq circuit breaker open: timeout_streak={} cooldown={}s",
                            timeoutStreakThreshold, Math.max(1L, circuitCooldownMs / 1000L));
                }
                return;
            }
        }
    }

    private void waitIfCircuitOpen() throws InterruptedException {
        while (true) {
            long until = circuitOpenUntilNanos.get();
            long now = System.nanoTime();
            if (until <= now) {
                return;
            }
            TimeUnit.NANOSECONDS.sleep(until - now);
        }
    }

    private void throttleRequest(long pauseMs) throws InterruptedException {
        if (pauseMs <= 0L) {
            return;
        }
        long pauseNanos = pauseMs * 1_000_000L;
        while (true) {
            long prev = lastRequestAtNanos.get();
            long now = System.nanoTime();
            long nextAllowed = prev + pauseNanos;
            if (now < nextAllowed) {
                TimeUnit.NANOSECONDS.sleep(nextAllowed - now);
                continue;
            }
            if (lastRequestAtNanos.compareAndSet(prev, now)) {
                return;
            }
        }
    }

    private static boolean isRetryable(String message) {
        String msg = message.toLowerCase(Locale.ROOT);
        if (msg.contains("timed out") || msg.contains("timeout") || msg.contains("connection reset")) {
            return true;
        }
        return msg.contains("http status=429") || msg.contains("http status=500") || msg.contains("http status=502")
                || msg.contains("http status=503") || msg.contains("http status=504");
    }

    /**
     * Parses a Stooq daily CSV body. Malformed lines are skipped; the volume column is optional (indices, FX).
     */
    static List<PriceBar> parseCsv(String symbol, String body) {
        if (body == null) {
            return List.of();
        }
        String text = body.trim();
        if (text.isEmpty() || text.equalsIgnoreCase("No data")) {
            return List.of();
        }
        if (text.toLowerCase(Locale.ROOT).contains("exceeded the daily hits limit")) {
            throw new IllegalStateException("stooq_rate_limit");
        }

        String[] lines = text.split("\\r?\\n");
        String header = lines[0].trim().toLowerCase(Locale.ROOT);
        if (!header.startsWith("date,open,high,low,close")) {
            String sample = text.length() > 120 ? text.substring(0, 120) : text;
            throw new IllegalStateException("unexpected_stooq_payload:" + sample);
        }

        List<PriceBar> all = new ArrayList<>(Math.max(64, lines.length));
        int skipped = 0;
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] cols = line.split(",");
            if (cols.length < 5) {
                skipped++;
                continue;
            }
            try {
                LocalDate date = LocalDate.parse(cols[0].trim());
                double volume = cols.length >= 6 ? parseDouble(cols[5]) : 0.0;
                all.add(new PriceBar(symbol, date, parseDouble(cols[1]), parseDouble(cols[2]),
                        parseDouble(cols[3]), parseDouble(cols[4]), volume));
            } catch (RuntimeException e) {
                skipped++;
            }
        }
        if (skipped > 0) {
            LOG.debug("stooq csv symbol={} skipped_lines={}", symbol, skipped);
        }
        return all;
    }

    private static double parseDouble(String input) {
        String v = input == null ? "" : input.trim();
        if (v.isEmpty() || v.equalsIgnoreCase("null")) {
            return Double.NaN;
        }
        return Double.parseDouble(v);
    }
}
