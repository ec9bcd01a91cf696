package com.portfoliorisk.backend.service.optimization;

import org.assertj.core.data.Offset;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WeightBoundsTest {

    @Test
    void capsAreEnforcedAndExcessIsRedistributed() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("DOGE", 0.5);
        weights.put("BTC", 0.3);
        weights.put("ETH", 0.2);

        Map<String, Double> bounded = WeightBounds.clampAndNormalize(weights,
                symbol -> symbol.equals("DOGE") ? 0.10 : 1.0, 0.0, 20);

        assertThat(bounded.get("DOGE")).isCloseTo(0.10, Offset.offset(1e-6));
        assertThat(bounded.get("BTC")).isCloseTo(0.54, Offset.offset(1e-6));
        assertThat(bounded.get("ETH")).isCloseTo(0.36, Offset.offset(1e-6));
    }

    @Test
    void floorLiftsTinyWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("BTC", 0.995);
        weights.put("ETH", 0.005);

        Map<String, Double> bounded = WeightBounds.clampAndNormalize(weights, symbol -> 1.0, 0.02, 20);

        assertThat(bounded.get("ETH")).isGreaterThanOrEqualTo(0.02 - 1e-6);
        assertThat(bounded.values().stream().mapToDouble(Double::doubleValue).sum()).isCloseTo(1.0, Offset.offset(1e-12));
    }

    @Test
    void infeasibleCapsStillSumToOne() {
        Map<String, Double> bounded = WeightBounds.clampAndNormalize(Map.of("BTC", 0.6, "ETH", 0.4),
                symbol -> 0.3, 0.0, 20);

        assertThat(bounded.values().stream().mapToDouble(Double::doubleValue).sum()).isCloseTo(1.0, Offset.offset(1e-12));
    }

    @Test
    void normalizeFallsBackToEqualWeights() {
        Map<String, Double> normalized = WeightBounds.normalize(Map.of("BTC", 0.0, "ETH", -1.0));

        assertThat(normalized).containsEntry("BTC", 0.5).containsEntry("ETH", 0.5);
    }
}
