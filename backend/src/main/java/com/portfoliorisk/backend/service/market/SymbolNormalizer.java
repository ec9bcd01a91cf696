package com.portfoliorisk.backend.service.market;

import com.portfoliorisk.backend.config.MarketDataProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps held asset tickers to the trading pairs the price source understands.
 */
@Component
public class SymbolNormalizer {

    private static final String DEFAULT_QUOTE = "USDT";
    private static final String USDT_QUOTE = "USD";

    private final Set<String> stablecoins;

    public SymbolNormalizer(MarketDataProperties marketDataProperties) {
        this.stablecoins = marketDataProperties.getStablecoins().stream()
                .map(value -> value.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public String normalize(String symbol) {
        if (!StringUtils.hasText(symbol)) {
            return "";
        }
        String upper = symbol.trim().toUpperCase(Locale.ROOT);
        for (char delimiter : new char[] {'/', '-', '_', ':'}) {
            int idx = upper.indexOf(delimiter);
            if (idx > 0 && idx < upper.length() - 1) {
                return upper.substring(0, idx) + "/" + upper.substring(idx + 1);
            }
        }
        if (DEFAULT_QUOTE.equals(upper)) {
            return DEFAULT_QUOTE + "/" + USDT_QUOTE;
        }
        return upper + "/" + DEFAULT_QUOTE;
    }

    /** Base asset of a ticker or pair, upper-cased. */
    public String baseAsset(String symbol) {
        if (!StringUtils.hasText(symbol)) {
            return "";
        }
        String upper = symbol.trim().toUpperCase(Locale.ROOT);
        for (char delimiter : new char[] {'/', '-', '_', ':'}) {
            int idx = upper.indexOf(delimiter);
            if (idx > 0) {
                return upper.substring(0, idx);
            }
        }
        return upper;
    }

    public boolean isStablecoin(String symbol) {
        return stablecoins.contains(baseAsset(symbol));
    }
}
