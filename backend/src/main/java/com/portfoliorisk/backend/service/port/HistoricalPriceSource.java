package com.portfoliorisk.backend.service.port;

import com.portfoliorisk.backend.model.Candle;

import java.util.List;

public interface HistoricalPriceSource {

    /** Unknown symbols yield an empty list. */
    List<Candle> getHistoricalOhlcv(String symbol, String timeframe, int limit);
}
