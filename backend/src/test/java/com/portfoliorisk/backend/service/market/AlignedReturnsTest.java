package com.portfoliorisk.backend.service.market;

import com.portfoliorisk.backend.model.PricePoint;
import com.portfoliorisk.backend.model.PriceSeries;
import com.portfoliorisk.backend.util.TestCandleFactory;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AlignedReturnsTest {

    @Test
    void returnsCoverOnlyDatesEverySeriesHas() {
        Map<String, PriceSeries> history = new LinkedHashMap<>();
        history.put("BTC", series("BTC", 0, 100.0, 110.0, 121.0, 133.1, 146.41));
        history.put("ETH", series("ETH", 2, 10.0, 12.0, 15.0));

        AlignedReturns aligned = AlignedReturns.of(history);

        assertThat(aligned.length()).isEqualTo(2);
        assertReturns(aligned.returns("BTC"), 0.1, 0.1);
        assertReturns(aligned.returns("ETH"), 0.2, 0.25);
    }

    @Test
    void skippedDayBecomesOneLongerInterval() {
        Map<String, PriceSeries> history = new LinkedHashMap<>();
        history.put("BTC", series("BTC", 0, 100.0, 110.0, 121.0));
        history.put("SOL", new PriceSeries("SOL", List.of(point(0, 50.0), point(2, 60.0))));

        AlignedReturns aligned = AlignedReturns.of(history);

        assertThat(aligned.length()).isEqualTo(1);
        assertThat(aligned.returns("BTC").get(0)).isCloseTo(0.21, Offset.offset(1e-12));
        assertThat(aligned.returns("SOL").get(0)).isCloseTo(0.2, Offset.offset(1e-12));
    }

    @Test
    void outsideSeriesIsNanWhereItHasNoClose() {
        AlignedReturns aligned = AlignedReturns.of(Map.of("BTC", series("BTC", 0, 100.0, 110.0, 121.0)));

        List<Double> other = aligned.returnsOf(series("ADA", 1, 1.0, 1.5));

        assertThat(other).hasSize(2);
        assertThat(other.get(0)).isNaN();
        assertThat(other.get(1)).isCloseTo(0.5, Offset.offset(1e-12));
    }

    @Test
    void tailKeepsMostRecentObservations() {
        AlignedReturns aligned = AlignedReturns.of(Map.of("BTC", series("BTC", 0, 100.0, 200.0, 100.0, 150.0)));

        AlignedReturns recent = aligned.tail(2);

        assertThat(recent.length()).isEqualTo(2);
        assertReturns(recent.returns("BTC"), -0.5, 0.5);
        assertReturns(recent.returnsOf(series("BTC", 0, 100.0, 200.0, 100.0, 150.0)), -0.5, 0.5);
    }

    @Test
    void emptyHistoryHasNoObservations() {
        AlignedReturns aligned = AlignedReturns.of(Map.of());

        assertThat(aligned.length()).isZero();
        assertThat(aligned.contains("BTC")).isFalse();
    }

    private static void assertReturns(List<Double> actual, double... expected) {
        assertThat(actual).hasSize(expected.length);
        for (int i = 0; i < expected.length; i++) {
            assertThat(actual.get(i)).isCloseTo(expected[i], Offset.offset(1e-12));
        }
    }

    private static PriceSeries series(String symbol, int firstDay, double... closes) {
        List<PricePoint> points = new ArrayList<>();
        for (int i = 0; i < closes.length; i++) {
            points.add(point(firstDay + i, closes[i]));
        }
        return new PriceSeries(symbol, points);
    }

    private static PricePoint point(int day, double close) {
        return new PricePoint(TestCandleFactory.START.plus(Duration.ofDays(day)), close);
    }
}
