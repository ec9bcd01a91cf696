package com.portfoliorisk.backend.service.market;

import com.portfoliorisk.backend.config.MarketDataProperties;
import com.portfoliorisk.backend.model.Candle;
import com.portfoliorisk.backend.model.PriceSeries;
import com.portfoliorisk.backend.service.RiskEngineMetrics;
import com.portfoliorisk.backend.util.MapHistoricalPriceSource;
import com.portfoliorisk.backend.util.MutableClock;
import com.portfoliorisk.backend.util.TestCandleFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HistoricalPriceCacheTest {

    private MapHistoricalPriceSource source;
    private MutableClock clock;
    private RiskEngineMetrics metrics;
    private HistoricalPriceCache cache;

    @BeforeEach
    void setUp() {
        source = new MapHistoricalPriceSource()
                .with("BTC/USDT", TestCandleFactory.trendingCandles(30, 30_000.0, 0.01))
                .with("ETH/USDT", TestCandleFactory.trendingCandles(30, 2_000.0, 0.01));
        clock = new MutableClock(TestCandleFactory.START);
        metrics = new RiskEngineMetrics(new SimpleMeterRegistry());
        MarketDataProperties properties = new MarketDataProperties();
        cache = new HistoricalPriceCache(source, new SymbolNormalizer(properties), properties, clock, Runnable::run, metrics);
    }

    @Test
    void servesFromCacheWithinTtlAndRefetchesAfterExpiry() {
        PriceSeries first = cache.fetch("BTC", 20, "1d");
        PriceSeries second = cache.fetch("btc", 20, "1d");

        assertThat(first.size()).isEqualTo(20);
        assertThat(second).isSameAs(first);
        assertThat(source.calls()).isEqualTo(1);

        clock.advance(Duration.ofMinutes(16));
        cache.fetch("BTC", 20, "1d");

        assertThat(source.calls()).isEqualTo(2);
    }

    @Test
    void defaultFetchUsesConfiguredLookback() {
        source.with("ADA/USDT", TestCandleFactory.trendingCandles(400, 0.5, 0.001));

        PriceSeries series = cache.fetch("ADA");

        assertThat(series.size()).isEqualTo(180);
        assertThat(series.closes().get(179)).isEqualTo(TestCandleFactory.trendingCandles(400, 0.5, 0.001).get(399).close());
    }

    @Test
    void lookbackIsPartOfTheCacheKey() {
        cache.fetch("BTC", 20, "1d");
        cache.fetch("BTC", 10, "1d");

        assertThat(source.calls()).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void sortsByTimeAndKeepsLastValueForDuplicateTimestamps() {
        Candle day0 = TestCandleFactory.candle(0, 100.0);
        Candle day1 = TestCandleFactory.candle(1, 101.0);
        Candle day1Revised = TestCandleFactory.candle(1, 105.0);
        Candle day2 = TestCandleFactory.candle(2, 102.0);
        Candle day3 = TestCandleFactory.candle(3, 103.0);
        Candle broken = TestCandleFactory.candle(4, -1.0);
        source.with("SOL/USDT", List.of(day3, day1, day0, broken, day2, day1Revised));

        PriceSeries series = cache.fetch("SOL", 10, "1d");

        assertThat(series.closes()).containsExactly(100.0, 105.0, 102.0, 103.0);
        assertThat(series.points().get(0).timestamp()).isEqualTo(day0.timestamp());
        assertThat(series.symbol()).isEqualTo("SOL/USDT");
    }

    @Test
    void failingSymbolDoesNotDropSiblings() {
        source.failing("ETH/USDT");

        Map<String, PriceSeries> result = cache.fetchAll(List.of("BTC", "ETH"), 20, "1d");

        assertThat(result).containsOnlyKeys("BTC");
        assertThat(metrics.snapshot().get("priceFetchFailures")).isEqualTo(1L);
    }

    @Test
    void emptyAndFailedResultsAreNotCached() {
        source.failing("ADA/USDT");

        assertThat(cache.fetch("XRP", 20, "1d").isEmpty()).isTrue();
        assertThat(cache.fetch("XRP", 20, "1d").isEmpty()).isTrue();
        assertThat(cache.fetch("ADA", 20, "1d").isEmpty()).isTrue();

        assertThat(source.calls()).isEqualTo(3);
        assertThat(cache.size()).isZero();
    }

    @Test
    void invalidateDropsEveryEntryForSymbol() {
        cache.fetch("BTC", 20, "1d");
        cache.fetch("BTC", 10, "1d");
        cache.fetch("ETH", 10, "1d");

        cache.invalidate("BTC");

        assertThat(cache.size()).isEqualTo(1);
        cache.clear();
        assertThat(cache.size()).isZero();
    }
}
