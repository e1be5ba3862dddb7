package com.nightscan.data.rss;

import com.nightscan.model.NewsItem;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RssParserTest {

    private static final String FEED = "<?xml version=\"1.0\"?><rss><channel>"
            + "<item><title>Apple beats estimates - Reuters</title><link>https://example.com/a</link>"
            + "<pubDate>Tue, 02 Jan 2024 13:00:00 GMT</pubDate></item>"
            + "<item><title>Second</title><link>https://news.example.org/b</link><pubDate>not a date</pubDate></item>"
            + "<item><title>Third</title><source>Bloomberg</source></item>"
            + "</channel></rss>";

    @Test
    void parse_shouldReadItemsAndGuessSources() throws Exception {
        List<NewsItem> items = RssParser.parse(FEED, 10);

        assertEquals(3, items.size());
        assertEquals("Reuters", items.get(0).source);
        assertNotNull(items.get(0).publishedAt);
        assertEquals("news.example.org", items.get(1).source);
        assertNull(items.get(1).publishedAt);
        assertEquals("Bloomberg", items.get(2).source);
    }

    @Test
    void parse_shouldHonourMaxItems() throws Exception {
        assertEquals(1, RssParser.parse(FEED, 1).size());
    }

    @Test
    void parse_shouldRejectMalformedXml() {
        assertThrows(IOException.class, () -> RssParser.parse("<rss><item>", 5));
    }

    @Test
    void query_shouldPreferCompanyName() {
        assertEquals("\"Apple Inc.\" OR AAPL stock", RssNewsSource.query("aapl.us", "Apple Inc."));
        assertEquals("AAPL stock", RssNewsSource.query("aapl.us", "aapl.us"));
    }
}
