package com.portfoliorisk.backend.service.port;

import com.portfoliorisk.backend.model.Portfolio;

public interface PortfolioProvider {

    /**
     * Returns the consolidated multi-exchange snapshot, or an empty portfolio when the
     * user holds nothing. Implementations may throw when the upstream is unreachable.
     */
    Portfolio getConsolidatedPortfolio(String userId);
}
