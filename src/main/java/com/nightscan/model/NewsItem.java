package com.nightscan.model;

import java.time.ZonedDateTime;

/**
 * 模块说明：NewsItem（class）。
 * 主要职责：一条新闻标题及其来源、链接与发布时间。
 * 使用建议：publishedAt 可能为空（RSS 日期无法解析时）。
 */
public final class NewsItem {
    public final String title;
    public final String link;
    public final String source;
    public final ZonedDateTime publishedAt;

    public NewsItem(String title, String link, String source, ZonedDateTime publishedAt) {
        this.title = title == null ? "" : title;
        this.link = link == null ? "" : link;
        this.source = source == null ? "" : source;
        this.publishedAt = publishedAt;
    }
}
