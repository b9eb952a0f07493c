package com.capgains.api.controller;

import com.capgains.domain.ExchangeRateRepository;
import com.capgains.domain.OrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Import orders and rates over HTTP, then calculate the year's report as JSON and CSV.
 */
@SpringBootTest(properties = {
        "capgains.fx.frankfurter.enabled=false",
        "capgains.fx.nearby-lookback-days=0"
})
@AutoConfigureWebTestClient
@Testcontainers(disabledWithoutDocker = true)
class TaxApiIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    OrderRepository orderRepository;
    @Autowired
    ExchangeRateRepository exchangeRateRepository;

    @BeforeEach
    void clean() {
        orderRepository.deleteAll();
        exchangeRateRepository.deleteAll();
    }

    @Test
    @DisplayName("imported orders and rates produce a complete 2024 report")
    void completeReport() {
        putRate("2024-01-10", "7");
        putRate("2024-06-03", "7.1");
        importOrders("""
                {"orders":[
                  {"orderId":"b1","symbol":"aapl.us","side":"BUY","quantity":100,"price":10,"currency":"usd",
                   "fees":[],"tradeDate":"2024-01-10","sequenceId":1},
                  {"orderId":"s1","symbol":"AAPL.US","side":"SELL","quantity":50,"price":20,"currency":"USD",
                   "fees":[],"tradeDate":"2024-06-03","sequenceId":2}
                ]}
                """, 2);

        webTestClient.get().uri("/api/v1/tax/2024")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.complete").isEqualTo(true)
                .jsonPath("$.baseCurrency").isEqualTo("CNY")
                .jsonPath("$.symbols[0].symbol").isEqualTo("AAPL.US")
                .jsonPath("$.symbols[0].events[0].orderId").isEqualTo("s1")
                .jsonPath("$.netGainLoss").value(v -> assertThat(new BigDecimal(v.toString())).isEqualByComparingTo("3600"))
                .jsonPath("$.taxDue").value(v -> assertThat(new BigDecimal(v.toString())).isEqualByComparingTo("720"));

        webTestClient.get().uri("/api/v1/tax/2024/summary.csv")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(TaxController.TEXT_CSV)
                .expectBody(String.class)
                .value(csv -> assertThat(csv)
                        .startsWith("symbol,events,")
                        .contains("AAPL.US,1,7100,3500,3600,0,3600,,OK")
                        .endsWith("TOTAL,1,7100,3500,3600,0,3600,720,COMPLETE\n"));

        webTestClient.get().uri("/api/v1/tax/2024/detail.csv")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(TaxController.TEXT_CSV)
                .expectBody(String.class)
                .value(csv -> assertThat(csv)
                        .startsWith("symbol,order_id,sequence_id,")
                        .endsWith("AAPL.US,s1,2,2024-06-03,LONG,50,7100,3500,3600,7.1\n"));
    }

    @Test
    @DisplayName("unknown fees are listed and make the report incomplete (207)")
    void unknownFeesGiveMultiStatus() {
        putRate("2024-02-01", "7");
        importOrders("""
                {"orders":[
                  {"orderId":"b1","symbol":"TSLA.US","side":"BUY","quantity":1,"price":200,"currency":"USD",
                   "fees":[{"name":"commission","amount":1}],"tradeDate":"2024-02-01","sequenceId":1},
                  {"orderId":"s1","symbol":"TSLA.US","side":"SELL","quantity":1,"price":210,"currency":"USD",
                   "tradeDate":"2024-02-01","sequenceId":2}
                ]}
                """, 2);

        webTestClient.get().uri("/api/v1/orders/missing-fees?year=2024")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].orderId").isEqualTo("s1");

        webTestClient.get().uri("/api/v1/tax/2024")
                .exchange()
                .expectStatus().isEqualTo(207)
                .expectBody()
                .jsonPath("$.complete").isEqualTo(false)
                .jsonPath("$.failures[0].symbol").isEqualTo("TSLA.US")
                .jsonPath("$.failures[0].errorCode").isEqualTo("FEE_DATA_UNKNOWN");
    }

    @Test
    @DisplayName("order with zero quantity is rejected with 400")
    void invalidOrderRejected() {
        webTestClient.post().uri("/api/v1/orders")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"orders":[{"orderId":"x","symbol":"AAPL.US","side":"BUY","quantity":0,"price":1,
                          "currency":"USD","tradeDate":"2024-01-02","sequenceId":1}]}
                        """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ORDER")
                .jsonPath("$.timestamp").exists();
    }

    @Test
    @DisplayName("rate with a non-positive value is rejected with 400")
    void invalidRateRejected() {
        webTestClient.put().uri("/api/v1/exchange-rates")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"date":"2024-01-02","fromCurrency":"USD","toCurrency":"CNY","rate":0}
                        """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_RATE");
    }

    @Test
    @DisplayName("year outside the supported range is rejected with 400")
    void invalidYear() {
        webTestClient.get().uri("/api/v1/tax/99")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_YEAR");
    }

    private void putRate(String date, String rate) {
        webTestClient.put().uri("/api/v1/exchange-rates")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"date\":\"" + date + "\",\"fromCurrency\":\"usd\",\"toCurrency\":\"CNY\",\"rate\":" + rate + "}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.fromCurrency").isEqualTo("USD")
                .jsonPath("$.source").isEqualTo("MANUAL");
    }

    private void importOrders(String body, int expected) {
        webTestClient.post().uri("/api/v1/orders")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.imported").isEqualTo(expected);
    }
}
