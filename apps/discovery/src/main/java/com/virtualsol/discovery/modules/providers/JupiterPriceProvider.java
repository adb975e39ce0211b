package com.virtualsol.discovery.modules.providers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.util.MintValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Jupiter price API, used when no cached price exists.
 *
 * <p>Accepts both response layouts: {@code {"data": {"<mint>": {"price": ..}}}} and
 * {@code {"<mint>": {"usdPrice": ..}}}.
 */
@Slf4j
@Component
@Order(2)
@ConditionalOnProperty(prefix = "discovery.market", name = "jupiter-enabled", havingValue = "true", matchIfMissing = true)
public class JupiterPriceProvider implements TokenPriceProvider {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String priceUrl;

    @Autowired
    public JupiterPriceProvider(DiscoveryProperties properties, ObjectMapper objectMapper) {
        this(createRestTemplate(properties.getMarket()), objectMapper, properties.getMarket().getJupiterPriceUrl());
    }

    JupiterPriceProvider(RestTemplate restTemplate, ObjectMapper objectMapper, String priceUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.priceUrl = priceUrl;
    }

    @Override
    public Optional<BigDecimal> getPriceUsd(String mint) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
            ResponseEntity<String> response = restTemplate.exchange(
                    priceUrl + "?ids=" + mint,
                    HttpMethod.GET,
                    new HttpEntity<>(headers),
                    String.class
            );

            if (response.getStatusCode() == HttpStatus.NO_CONTENT || response.getBody() == null) {
                log.debug("Jupiter has no price for {}", MintValidator.abbreviate(mint));
                return Optional.empty();
            }
            return parsePrice(objectMapper.readTree(response.getBody()), mint);
        } catch (RestClientException | JsonProcessingException e) {
            log.debug("Jupiter price lookup failed for {}: {}", MintValidator.abbreviate(mint), e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<BigDecimal> parsePrice(JsonNode root, String mint) {
        JsonNode entry = root.path("data").path(mint);
        JsonNode price = entry.path("price");
        if (price.isMissingNode() || price.isNull()) {
            price = root.path(mint).path("usdPrice");
        }
        if (price.isMissingNode() || price.isNull()) {
            return Optional.empty();
        }
        try {
            BigDecimal value = new BigDecimal(price.asText().trim());
            return value.signum() > 0 ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static RestTemplate createRestTemplate(DiscoveryProperties.Market market) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        int timeout = (int) market.getRequestTimeout().toMillis();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return new RestTemplate(factory);
    }
}
