package com.nightscan.data.rss;

import com.nightscan.config.Config;
import com.nightscan.data.FetchException;
import com.nightscan.data.NewsSource;
import com.nightscan.data.http.HttpClientEx;
import com.nightscan.model.NewsItem;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 模块说明：RssNewsSource（class）。
 * 主要职责：按 标的代码 + 公司名 查询 RSS 搜索源，返回去重后的新闻标题。
 * 使用建议：每次请求都带超时，超时按单标的失败处理。
 */
public final class RssNewsSource implements NewsSource {
    private final HttpClientEx http;
    private final String urlTemplate;
    private final int timeoutSec;
    private final int maxItems;

    public RssNewsSource(Config config) {
        this(new HttpClientEx(config.getInt("news.timeout_sec")),
                config.getString("news.rss_url"),
                config.getInt("news.timeout_sec"),
                config.getInt("news.max_items"));
    }

    public RssNewsSource(HttpClientEx http, String urlTemplate, int timeoutSec, int maxItems) {
        this.http = http;
        this.urlTemplate = urlTemplate;
        this.timeoutSec = Math.max(1, timeoutSec);
        this.maxItems = Math.max(1, maxItems);
    }

    @Override
    public List<NewsItem> fetch(String symbol, String companyName) throws FetchException {
        String url = String.format(urlTemplate, URLEncoder.encode(query(symbol, companyName), StandardCharsets.UTF_8));
        try {
            List<NewsItem> items = RssParser.parse(http.getText(url, timeoutSec), maxItems * 2);
            Set<String> seenTitles = new LinkedHashSet<>();
            return items.stream()
                    .filter(item -> !item.title.isEmpty())
                    .filter(item -> seenTitles.add(item.title.toLowerCase(Locale.ROOT)))
                    .limit(maxItems)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new FetchException(symbol, "news fetch failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(symbol, "news fetch interrupted", e);
        }
    }

    static String query(String symbol, String companyName) {
        String base = symbol == null ? "" : symbol.trim();
        int dot = base.indexOf('.');
        if (dot > 0) {
            base = base.substring(0, dot);
        }
        if (companyName != null && !companyName.isBlank() && !companyName.trim().equalsIgnoreCase(symbol)) {
            return "\"" + companyName.trim() + "\" OR " + base.toUpperCase(Locale.ROOT) + " stock";
        }
        return base.toUpperCase(Locale.ROOT) + " stock";
    }
}
