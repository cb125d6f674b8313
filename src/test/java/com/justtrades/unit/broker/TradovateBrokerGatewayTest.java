package com.justtrades.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.justtrades.broker.BrokerCallPolicy;
import com.justtrades.broker.ConfiguredAccountSessionProvider;
import com.justtrades.broker.tradovate.TradovateBrokerGateway;
import com.justtrades.broker.tradovate.TradovateContractCache;
import com.justtrades.config.TradovateConfig;
import com.justtrades.domain.enums.OrderPurpose;
import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.model.BrokerPosition;
import com.justtrades.domain.model.OrderIntent;
import com.justtrades.domain.model.PositionKey;
import com.justtrades.exception.OrderNotFoundException;
import com.justtrades.exception.OrderRejectedException;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class TradovateBrokerGatewayTest {

    private static final String BASE = "https://demo.test/v1";
    private static final PositionKey KEY = PositionKey.of("123", "MNQZ5");

    private MockRestServiceServer server;
    private TradovateBrokerGateway gateway;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();
        RestClient client = builder.build();

        TradovateConfig tradovateConfig = new TradovateConfig();
        TradovateConfig.Account account = new TradovateConfig.Account();
        account.setAccountId("123");
        account.setAccountSpec("DEMO123");
        account.setAccessToken("secret-token");
        tradovateConfig.getAccounts().add(account);

        gateway = new TradovateBrokerGateway(
                new ConfiguredAccountSessionProvider(tradovateConfig),
                new BrokerCallPolicy(
                        RateLimiterRegistry.of(Map.of("brokerToken", RateLimiterConfig.ofDefaults())),
                        RetryRegistry.ofDefaults()),
                new TradovateContractCache(),
                tradovateConfig,
                new ObjectMapper(),
                client,
                client);
    }

    @Test
    @DisplayName("Market orders are posted as automated Day orders and return the broker order id")
    void placeOrder() {
        server.expect(requestTo(BASE + "/order/placeorder"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer secret-token"))
                .andExpect(jsonPath("$.action").value("Sell"))
                .andExpect(jsonPath("$.orderType").value("Market"))
                .andExpect(jsonPath("$.orderQty").value(2))
                .andExpect(jsonPath("$.accountId").value(123))
                .andExpect(jsonPath("$.isAutomated").value(true))
                .andExpect(jsonPath("$.price").doesNotExist())
                .andRespond(withSuccess("{\"orderId\":555}", MediaType.APPLICATION_JSON));

        String orderId = gateway.placeOrder(OrderIntent.exit(KEY, OrderSide.SELL, 2));

        assertThat(orderId).isEqualTo("555");
        server.verify();
    }

    @Test
    @DisplayName("A failure text in the response is a rejection")
    void placeOrder_failureText() {
        server.expect(requestTo(BASE + "/order/placeorder"))
                .andRespond(withSuccess("{\"failureReason\":\"RiskCheck\",\"failureText\":\"Max position exceeded\"}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway.placeOrder(OrderIntent.market(KEY, OrderSide.BUY, 1, OrderPurpose.ENTRY)))
                .isInstanceOf(OrderRejectedException.class)
                .hasMessageContaining("Max position exceeded");
    }

    @Test
    @DisplayName("HTTP 4xx on placement is a rejection")
    void placeOrder_badRequest() {
        server.expect(requestTo(BASE + "/order/placeorder"))
                .andRespond(withBadRequest().body("invalid symbol"));

        assertThatThrownBy(() -> gateway.placeOrder(OrderIntent.market(KEY, OrderSide.BUY, 1, OrderPurpose.ENTRY)))
                .isInstanceOf(OrderRejectedException.class)
                .hasMessageContaining("HTTP 400");
    }

    @Test
    @DisplayName("Position query resolves the contract id and picks this account's row")
    void queryPosition() {
        server.expect(requestTo(BASE + "/contract/find?name=MNQZ5"))
                .andRespond(withSuccess("{\"id\":42,\"name\":\"MNQZ5\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/position/list"))
                .andRespond(withSuccess("""
                        [
                          {"id":1,"accountId":999,"contractId":42,"netPos":5,"netPrice":20000},
                          {"id":2,"accountId":123,"contractId":42,"netPos":-2,"netPrice":21000.25}
                        ]
                        """, MediaType.APPLICATION_JSON));

        BrokerPosition position = gateway.queryPosition("123", "MNQZ5");

        assertThat(position.quantity()).isEqualTo(-2);
        assertThat(position.averagePrice()).isEqualByComparingTo("21000.25");
        server.verify();
    }

    @Test
    @DisplayName("Cancel of an order the broker does not know raises OrderNotFoundException")
    void cancel_notFound() {
        server.expect(requestTo(BASE + "/order/cancelorder"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> gateway.cancelOrder("123", "77"))
                .isInstanceOf(OrderNotFoundException.class);
    }
}
