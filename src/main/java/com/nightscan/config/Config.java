package com.nightscan.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 模块说明：Config（class）。
 * 主要职责：按 classpath config.properties → 工作目录 config.properties → 内置默认值 的顺序解析配置。
 * 使用建议：新增配置键时同步补充 DEFAULTS，保证缺省运行行为可预期。
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

/**
 * 方法说明：load，负责加载配置。
 * 处理流程：先读取 classpath 资源，再用工作目录下的同名文件覆盖。
 * 维护提示：本地文件读取失败只告警，不中断启动。
 */
    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Build a Config from explicit values layered over the defaults; used by tests and ad hoc re-scoring.
     */
    public static Config of(Path workingDir, Map<String, String> values) {
        Config config = new Config(workingDir);
        if (values != null) {
            for (Map.Entry<String, String> entry : values.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    continue;
                }
                config.overrideProps.setProperty(entry.getKey().trim(), entry.getValue());
                config.props.setProperty(entry.getKey().trim(), entry.getValue());
            }
        }
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    /**
     * Like {@link #getString(String)} but an explicitly blank value stays blank instead of falling back to the default.
     */
    public String getRawString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            return raw.trim();
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

/**
 * 方法说明：getPath，负责把相对路径解析到工作目录下。
 * 处理流程：空值返回工作目录本身。
 * 维护提示：绝对路径原样返回。
 */
    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        String[] tokens = value.split("[,;]");
        for (String token : tokens) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    public ResolvedValue resolve(String key) {
        return new ResolvedValue(
                key == null ? "" : key,
                getString(key),
                sourceOf(key)
        );
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("report.dir", "outputs/reports");
        defaults.put("progress.path", "outputs/progress/pipeline_progress.json");
        defaults.put("progress.history_dir", "outputs/progress/history");
        defaults.put("universe.path", "universe.csv");
        defaults.put("app.zone", "UTC");

        defaults.put("stooq.base_url", "https://stooq.com/q/d/l/?s=%s&d1=%s&d2=%s&i=d");
        defaults.put("stooq.request_timeout_sec", "20");
        defaults.put("stooq.retry_count", "2");
        defaults.put("stooq.retry_sleep_ms", "700");
        defaults.put("stooq.request_pause_ms", "0");
        defaults.put("stooq.circuit_breaker.timeout_streak", "10");
        defaults.put("stooq.circuit_breaker.cooldown_sec", "60");

        defaults.put("scan.lookback_days", "400");
        defaults.put("scan.threads", "4");
        defaults.put("scan.progress.log_every", "50");

        defaults.put("validation.outlier_zscore", "3.0");
        defaults.put("validation.split_return_threshold", "-0.40");
        defaults.put("validation.split_volume_multiple", "2.0");

        defaults.put("regime.index_symbol", "^spx");
        defaults.put("regime.vol_symbol", "^vix");
        defaults.put("regime.fx_symbol", "eurusd");
        defaults.put("regime.lookback_days", "180");
        defaults.put("regime.min_rows", "50");
        defaults.put("regime.min_feature_rows", "40");
        defaults.put("regime.states", "3");
        defaults.put("regime.hmm.enabled", "true");
        defaults.put("regime.hmm.max_iter", "100");
        defaults.put("regime.hmm.tol", "0.0001");
        defaults.put("regime.gmm.max_iter", "200");
        defaults.put("regime.garch.enabled", "true");
        defaults.put("regime.garch.min_obs", "60");
        defaults.put("regime.ewma.lambda", "0.94");
        defaults.put("regime.crash.prob_weight", "0.6");

        defaults.put("beta.factors", "market:^spx,commodity:cl.f");
        defaults.put("beta.lookback_days", "90");
        defaults.put("beta.min_obs", "40");

        defaults.put("predict.threads", "4");
        defaults.put("predict.symbol_timeout_sec", "120");
        defaults.put("predict.progress.log_every", "25");
        defaults.put("predict.min_history_days", "60");
        defaults.put("predict.buy_threshold", "0.3");
        defaults.put("predict.sell_threshold", "-0.3");
        defaults.put("predict.direction.enabled", "true");
        defaults.put("predict.direction.epochs", "400");
        defaults.put("predict.direction.learning_rate", "0.1");
        defaults.put("predict.direction.l2", "0.01");
        defaults.put("predict.sentiment.enabled", "true");
        defaults.put("news.enabled", "true");
        defaults.put("news.rss_url", "https://news.google.com/rss/search?q=%s&hl=en-US&gl=US&ceid=US:en");
        defaults.put("news.timeout_sec", "15");
        defaults.put("news.max_items", "20");
        defaults.put("ai.base_url", "http://127.0.0.1:11434");
        defaults.put("ai.model", "llama3.1:latest");
        defaults.put("ai.timeout_sec", "120");
        defaults.put("ai.temperature", "0.0");

        defaults.put("scoring.weight.prediction_confidence", "0.30");
        defaults.put("scoring.weight.technical_strength", "0.20");
        defaults.put("scoring.weight.index_alignment", "0.15");
        defaults.put("scoring.weight.liquidity", "0.15");
        defaults.put("scoring.weight.volatility", "0.10");
        defaults.put("scoring.weight.sector_momentum", "0.10");
        defaults.put("scoring.min_opportunity_score", "65");
        defaults.put("scoring.top_n", "20");

        defaults.put("notify.channels", "log");
        defaults.put("email.enabled", "false");
        defaults.put("email.smtp_host", "smtp.gmail.com");
        defaults.put("email.smtp_port", "587");
        defaults.put("email.smtp_user", "");
        defaults.put("email.smtp_pass", "");
        defaults.put("email.from", "");
        defaults.put("email.to", "");
        defaults.put("email.subject_prefix", "[NightScan]");
        defaults.put("mail.dry_run", "false");
        defaults.put("mail.fail_fast", "false");
        defaults.put("mail.dry_run.dir", "");

        return Collections.unmodifiableMap(defaults);
    }

    public static final class ResolvedValue {
        public final String key;
        public final String value;
        public final String source;

        public ResolvedValue(String key, String value, String source) {
            this.key = key == null ? "" : key;
            this.value = value == null ? "" : value;
            this.source = source == null ? "default" : source;
        }
    }
}
