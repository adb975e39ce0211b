package com.virtualsol.discovery.modules.providers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.virtualsol.discovery.support.TestMints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class JupiterPriceProviderTest {

    private static final String PRICE_URL = "https://jupiter.test/price/v3";

    private MockRestServiceServer server;
    private JupiterPriceProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        provider = new JupiterPriceProvider(restTemplate, new ObjectMapper(), PRICE_URL);
    }

    @Test
    void readsFlatLayout() {
        server.expect(requestTo(PRICE_URL + "?ids=" + TestMints.TOKEN_A))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"%s":{"usdPrice":0.0000412,"decimals":6}}
                        """.formatted(TestMints.TOKEN_A), MediaType.APPLICATION_JSON));

        assertEquals(Optional.of(new BigDecimal("0.0000412")), provider.getPriceUsd(TestMints.TOKEN_A));
        server.verify();
    }

    @Test
    void readsNestedDataLayout() {
        server.expect(requestTo(PRICE_URL + "?ids=" + TestMints.TOKEN_A))
                .andRespond(withSuccess("""
                        {"data":{"%s":{"id":"%s","price":"0.0031"}}}
                        """.formatted(TestMints.TOKEN_A, TestMints.TOKEN_A), MediaType.APPLICATION_JSON));

        assertEquals(Optional.of(new BigDecimal("0.0031")), provider.getPriceUsd(TestMints.TOKEN_A));
    }

    @Test
    void unknownMintOrServerErrorYieldsNothing() {
        server.expect(requestTo(PRICE_URL + "?ids=" + TestMints.TOKEN_A))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(PRICE_URL + "?ids=" + TestMints.TOKEN_B))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertTrue(provider.getPriceUsd(TestMints.TOKEN_A).isEmpty());
        assertTrue(provider.getPriceUsd(TestMints.TOKEN_B).isEmpty());
    }
}
