package com.capgains.fx.resolver;

import com.capgains.config.FxConfig;
import com.capgains.config.FxProperties;
import com.capgains.domain.RateSource;
import com.capgains.fx.ExchangeRateStore;
import com.capgains.fx.RateRequest;
import com.capgains.fx.RateResolutionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Historical ECB reference rate via Frankfurter /{date}?from=X&to=Y. Fetched rates are stored so later
 * runs resolve them from the database.
 */
@Component
@Slf4j
public class FrankfurterRateResolver {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private final FxProperties fxProperties;
    private final WebClient.Builder webClientBuilder;
    private final RateLimiter rateLimiter;
    private final ExchangeRateStore exchangeRateStore;

    public FrankfurterRateResolver(FxProperties fxProperties,
                                   WebClient.Builder webClientBuilder,
                                   @Qualifier(FxConfig.FRANKFURTER_RATE_LIMITER) RateLimiter rateLimiter,
                                   ExchangeRateStore exchangeRateStore) {
        this.fxProperties = fxProperties;
        this.webClientBuilder = webClientBuilder;
        this.rateLimiter = rateLimiter;
        this.exchangeRateStore = exchangeRateStore;
    }

    public RateResolutionResult resolve(RateRequest request) {
        FxProperties.FrankfurterProperties props = fxProperties.getFrankfurter();
        if (!props.isEnabled()) {
            return RateResolutionResult.unknown();
        }
        String date = request.date().format(DateTimeFormatter.ISO_LOCAL_DATE);
        String url = props.getBaseUrl() + "/" + date + "?from=" + request.fromCurrency() + "&to=" + request.toCurrency();
        if (!rateLimiter.acquirePermission()) {
            log.warn("Frankfurter limiter timed out before {} {}->{}", date, request.fromCurrency(), request.toCurrency());
            return RateResolutionResult.unknown();
        }
        String body;
        try {
            body = webClientBuilder.build()
                    .get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(props.getTimeoutSeconds()));
        } catch (WebClientException | IllegalStateException e) {
            log.warn("Frankfurter lookup failed for {} {}->{}: {}", date, request.fromCurrency(),
                    request.toCurrency(), e.getMessage());
            return RateResolutionResult.unknown();
        }
        Optional<BigDecimal> rate = parseRate(body, request.toCurrency());
        if (rate.isEmpty()) {
            log.debug("Frankfurter returned no {} rate for {} on {}", request.toCurrency(), request.fromCurrency(), date);
            return RateResolutionResult.unknown();
        }
        exchangeRateStore.remember(request.date(), request.fromCurrency(), request.toCurrency(), rate.get(),
                RateSource.FRANKFURTER);
        return RateResolutionResult.known(rate.get(), RateSource.FRANKFURTER);
    }

    static Optional<BigDecimal> parseRate(String json, String toCurrency) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode value = MAPPER.readTree(json).path("rates").path(toCurrency);
            if (value.isMissingNode() || !value.isNumber()) {
                return Optional.empty();
            }
            return Optional.of(value.decimalValue());
        } catch (JsonProcessingException e) {
            log.debug("Unparseable Frankfurter response: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
