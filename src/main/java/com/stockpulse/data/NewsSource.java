package com.stockpulse.data;

import com.stockpulse.core.error.FetchException;
import com.stockpulse.model.DateRange;
import com.stockpulse.model.NewsArticle;

import java.util.List;

/**
 * Retrieves articles about a ticker published inside a date range. An empty list is not an error.
 */
public interface NewsSource {
    List<NewsArticle> fetchNews(String ticker, DateRange range) throws FetchException;
}
