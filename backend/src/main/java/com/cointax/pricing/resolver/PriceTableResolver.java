package com.cointax.pricing.resolver;

import com.cointax.common.CoinTaxException;
import com.cointax.pricing.HistoricalPriceRequest;
import com.cointax.pricing.PriceResolutionResult;
import com.cointax.pricing.config.PricingConfig;
import com.cointax.pricing.config.PricingProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Resolves prices from the JSON price table configured under cointax.pricing.price-file.
 * The parsed table is cached; a missing file setting yields an empty table.
 */
@Component
@Slf4j
public class PriceTableResolver {

    private static final TypeReference<List<PriceQuote>> QUOTES = new TypeReference<>() {
    };

    private final PricingProperties pricingProperties;
    private final ObjectMapper objectMapper;
    private final Cache<String, PriceTable> priceTableCache;

    public PriceTableResolver(PricingProperties pricingProperties,
                              ObjectMapper objectMapper,
                              @Qualifier(PricingConfig.PRICE_TABLE_CACHE) Cache<String, PriceTable> priceTableCache) {
        this.pricingProperties = pricingProperties;
        this.objectMapper = objectMapper;
        this.priceTableCache = priceTableCache;
    }

    public PriceResolutionResult resolve(HistoricalPriceRequest request) {
        if (request == null || request.getCoin() == null || request.getUtcTime() == null) {
            return PriceResolutionResult.unknown();
        }
        return table().lookup(request.getPlatform(), request.getCoin(), request.getUtcTime(),
                        pricingProperties.getMaxPriceAge())
                .map(PriceResolutionResult::fromQuote)
                .orElseGet(PriceResolutionResult::unknown);
    }

    PriceTable table() {
        String file = pricingProperties.getPriceFile();
        if (file == null || file.isBlank()) {
            return PriceTable.empty();
        }
        return priceTableCache.get(file, this::load);
    }

    private PriceTable load(String file) {
        Path path = Path.of(file);
        try (InputStream in = Files.newInputStream(path)) {
            PriceTable table = new PriceTable(objectMapper.readValue(in, QUOTES));
            log.info("Loaded {} price quotes from {}", table.size(), path);
            return table;
        } catch (IOException e) {
            throw new CoinTaxException("PRICE_TABLE_UNREADABLE", "Cannot read price table " + path, e);
        }
    }
}
