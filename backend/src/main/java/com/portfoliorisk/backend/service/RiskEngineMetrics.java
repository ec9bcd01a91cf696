package com.portfoliorisk.backend.service;

import com.portfoliorisk.backend.model.OptimizationStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
@RequiredArgsConstructor
public class RiskEngineMetrics {

    private final MeterRegistry meterRegistry;

    private final AtomicLong riskAssessments = new AtomicLong();
    private final AtomicLong optimizations = new AtomicLong();
    private final AtomicLong optimizationFallbacks = new AtomicLong();
    private final AtomicLong priceFetchFailures = new AtomicLong();
    private final AtomicLong riskAlerts = new AtomicLong();

    private Counter riskAssessmentsCounter;
    private Counter optimizationFallbacksCounter;
    private Counter priceFetchFailuresCounter;
    private Counter riskAlertsCounter;

    @PostConstruct
    void init() {
        riskAssessmentsCounter = Counter.builder("risk_assessments_total").register(meterRegistry);
        optimizationFallbacksCounter = Counter.builder("optimization_fallbacks_total").register(meterRegistry);
        priceFetchFailuresCounter = Counter.builder("price_fetch_failures_total").register(meterRegistry);
        riskAlertsCounter = Counter.builder("risk_alerts_total").register(meterRegistry);
    }

    public void recordRiskAssessment() {
        riskAssessments.incrementAndGet();
        if (riskAssessmentsCounter != null) {
            riskAssessmentsCounter.increment();
        }
    }

    public void recordOptimization(OptimizationStrategy strategy) {
        optimizations.incrementAndGet();
        Counter.builder("optimizations_total")
                .tag("strategy", strategy.code())
                .register(meterRegistry)
                .increment();
    }

    public void recordOptimizationFallback() {
        optimizationFallbacks.incrementAndGet();
        if (optimizationFallbacksCounter != null) {
            optimizationFallbacksCounter.increment();
        }
    }

    public void recordPriceFetchFailure() {
        priceFetchFailures.incrementAndGet();
        if (priceFetchFailuresCounter != null) {
            priceFetchFailuresCounter.increment();
        }
    }

    public void recordRiskAlerts(int count) {
        if (count <= 0) {
            return;
        }
        riskAlerts.addAndGet(count);
        if (riskAlertsCounter != null) {
            riskAlertsCounter.increment(count);
        }
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> snapshot = new LinkedHashMap<>();
        snapshot.put("riskAssessments", riskAssessments.get());
        snapshot.put("optimizations", optimizations.get());
        snapshot.put("optimizationFallbacks", optimizationFallbacks.get());
        snapshot.put("priceFetchFailures", priceFetchFailures.get());
        snapshot.put("riskAlerts", riskAlerts.get());
        return snapshot;
    }
}
