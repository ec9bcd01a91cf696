package com.portfoliorisk.backend.service.port;

import com.portfoliorisk.backend.model.Portfolio;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryPortfolioProvider implements PortfolioProvider {

    private final Map<String, Portfolio> portfolios = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryPortfolioProvider(Clock clock) {
        this.clock = clock;
    }

    public void register(Portfolio portfolio) {
        portfolios.put(portfolio.userId(), portfolio);
        log.debug("Registered portfolio for user {} with {} positions", portfolio.userId(), portfolio.positions().size());
    }

    public void remove(String userId) {
        portfolios.remove(userId);
    }

    @Override
    public Portfolio getConsolidatedPortfolio(String userId) {
        return portfolios.getOrDefault(userId, Portfolio.empty(userId, clock.instant()));
    }
}
