package com.portfoliorisk.backend.service.port;

import com.portfoliorisk.backend.model.Candle;

import java.util.List;

public class EmptyHistoricalPriceSource implements HistoricalPriceSource {

    @Override
    public List<Candle> getHistoricalOhlcv(String symbol, String timeframe, int limit) {
        return List.of();
    }
}
