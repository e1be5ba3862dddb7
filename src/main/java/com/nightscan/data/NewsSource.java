package com.nightscan.data;

import com.nightscan.model.NewsItem;

import java.util.List;

/**
 * Recent headlines for a symbol. An empty list is a valid "nothing found".
 */
public interface NewsSource {

    List<NewsItem> fetch(String symbol, String companyName) throws FetchException;
}
