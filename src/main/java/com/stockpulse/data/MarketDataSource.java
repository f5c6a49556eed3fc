package com.stockpulse.data;

import com.stockpulse.core.error.FetchException;
import com.stockpulse.model.DateRange;
import com.stockpulse.model.PriceSeries;

/**
 * Retrieves daily bars for a ticker, clipped to the requested range.
 */
public interface MarketDataSource {
    PriceSeries fetchPrices(String ticker, DateRange range) throws FetchException;
}
