package com.portfoliorisk.backend.service.market;

import com.portfoliorisk.backend.config.MarketDataProperties;
import com.portfoliorisk.backend.model.Candle;
import com.portfoliorisk.backend.model.PricePoint;
import com.portfoliorisk.backend.model.PriceSeries;
import com.portfoliorisk.backend.service.RiskEngineMetrics;
import com.portfoliorisk.backend.service.port.HistoricalPriceSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * TTL cache in front of the historical price source. Entries are replaced wholesale
 * and never mutated, so reads take no lock.
 */
@Slf4j
@Service
public class HistoricalPriceCache {

    private final HistoricalPriceSource priceSource;
    private final SymbolNormalizer symbolNormalizer;
    private final MarketDataProperties marketDataProperties;
    private final Clock clock;
    private final Executor priceFetchExecutor;
    private final RiskEngineMetrics metrics;

    private final Map<CacheKey, CacheEntry> cache = new ConcurrentHashMap<>();

    public HistoricalPriceCache(HistoricalPriceSource priceSource,
                                SymbolNormalizer symbolNormalizer,
                                MarketDataProperties marketDataProperties,
                                Clock clock,
                                @Qualifier("priceFetchExecutor") Executor priceFetchExecutor,
                                RiskEngineMetrics metrics) {
        this.priceSource = priceSource;
        this.symbolNormalizer = symbolNormalizer;
        this.marketDataProperties = marketDataProperties;
        this.clock = clock;
        this.priceFetchExecutor = priceFetchExecutor;
        this.metrics = metrics;
    }

    /** Uses the configured default lookback and timeframe. */
    public PriceSeries fetch(String symbol) {
        MarketDataProperties.Fetch fetch = marketDataProperties.getFetch();
        return fetch(symbol, fetch.getDefaultLookback(), fetch.getDefaultTimeframe());
    }

    public PriceSeries fetch(String symbol, int lookback, String timeframe) {
        String pair = symbolNormalizer.normalize(symbol);
        if (pair.isEmpty() || lookback <= 0) {
            return PriceSeries.empty(pair);
        }
        CacheKey key = new CacheKey(pair, timeframe, lookback);
        Instant now = clock.instant();
        CacheEntry entry = cache.get(key);
        if (entry != null && now.isBefore(entry.expiresAt())) {
            log.debug("Price cache hit for {} {} x{}", pair, timeframe, lookback);
            return entry.series();
        }

        List<Candle> candles;
        try {
            candles = priceSource.getHistoricalOhlcv(pair, timeframe, lookback);
        } catch (RuntimeException e) {
            log.warn("Price fetch failed for {} ({} x{}): {}", pair, timeframe, lookback, e.getMessage());
            metrics.recordPriceFetchFailure();
            return PriceSeries.empty(pair);
        }

        PriceSeries series = toSeries(pair, candles, lookback);
        if (!series.isEmpty()) {
            cache.put(key, new CacheEntry(series, now.plus(marketDataProperties.getCache().getPriceTtl())));
        }
        return series;
    }

    /**
     * Fetches distinct symbols concurrently. Symbols that fail or come back empty are
     * left out of the result, keyed by the caller's symbol.
     */
    public Map<String, PriceSeries> fetchAll(Collection<String> symbols, int lookback, String timeframe) {
        Map<String, CompletableFuture<PriceSeries>> futures = new LinkedHashMap<>();
        for (String symbol : new LinkedHashSet<>(symbols)) {
            if (symbol == null) {
                continue;
            }
            CompletableFuture<PriceSeries> future = CompletableFuture
                    .supplyAsync(() -> fetch(symbol, lookback, timeframe), priceFetchExecutor)
                    .handle((series, error) -> {
                        if (error != null) {
                            log.warn("Price fetch for {} did not complete: {}", symbol, error.getMessage());
                            metrics.recordPriceFetchFailure();
                            return PriceSeries.empty(symbol);
                        }
                        return series;
                    });
            futures.put(symbol, future);
        }

        Map<String, PriceSeries> result = new LinkedHashMap<>();
        futures.forEach((symbol, future) -> {
            PriceSeries series = future.join();
            if (series != null && !series.isEmpty()) {
                result.put(symbol, series);
            }
        });
        return result;
    }

    public void invalidate(String symbol) {
        String pair = symbolNormalizer.normalize(symbol);
        cache.keySet().removeIf(key -> key.symbol().equals(pair));
    }

    public void clear() {
        cache.clear();
    }

    public int size() {
        return cache.size();
    }

    private PriceSeries toSeries(String pair, List<Candle> candles, int lookback) {
        if (candles == null || candles.isEmpty()) {
            return PriceSeries.empty(pair);
        }
        TreeMap<Instant, Double> byTime = new TreeMap<>();
        for (Candle candle : candles) {
            if (candle == null || candle.timestamp() == null) {
                continue;
            }
            double close = candle.close();
            if (!Double.isFinite(close) || close <= 0) {
                continue;
            }
            byTime.put(candle.timestamp(), close);
        }
        List<PricePoint> points = new ArrayList<>(byTime.size());
        byTime.forEach((timestamp, close) -> points.add(new PricePoint(timestamp, close)));
        if (points.size() > lookback) {
            return new PriceSeries(pair, points.subList(points.size() - lookback, points.size()));
        }
        return new PriceSeries(pair, points);
    }

    private record CacheKey(String symbol, String timeframe, int lookback) {}

    private record CacheEntry(PriceSeries series, Instant expiresAt) {}
}
