package com.justtrades.broker.tradovate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.justtrades.broker.AccountSessionProvider;
import com.justtrades.broker.BrokerCallPolicy;
import com.justtrades.broker.BrokerEventListener;
import com.justtrades.broker.BrokerGateway;
import com.justtrades.config.TradovateConfig;
import com.justtrades.domain.enums.OrderSide;
import com.justtrades.domain.enums.OrderType;
import com.justtrades.domain.enums.TradingEnvironment;
import com.justtrades.domain.model.AccountSession;
import com.justtrades.domain.model.BrokerFill;
import com.justtrades.domain.model.BrokerPosition;
import com.justtrades.domain.model.OrderIntent;
import com.justtrades.exception.BrokerException;
import com.justtrades.exception.OrderNotFoundException;
import com.justtrades.exception.OrderRejectedException;
import com.justtrades.exception.ValidationException;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link BrokerGateway} over the Tradovate REST API.
 *
 * <p>Endpoints used:
 * <ul>
 *   <li>{@code POST /order/placeorder}, {@code POST /order/cancelorder}</li>
 *   <li>{@code GET /position/list}, {@code GET /order/list}, {@code GET /fill/list}</li>
 *   <li>{@code GET /contract/find?name=}, {@code GET /contract/item?id=}</li>
 * </ul>
 *
 * <p>Every call goes through {@link BrokerCallPolicy}. Placement and cancel are
 * single-shot; a transport failure on placement surfaces as {@link BrokerException}
 * (outcome unknown) and is never resubmitted here. HTTP 4xx on placement is a
 * rejection.
 *
 * <p>Push events come from one {@link TradovateUserSyncClient} per access token,
 * opened when a listener subscribes.
 */
@Component
@ConditionalOnProperty(name = "justtrades.engine.broker-mode", havingValue = "LIVE")
public class TradovateBrokerGateway implements BrokerGateway {

    private static final Logger log = LoggerFactory.getLogger(TradovateBrokerGateway.class);

    private final AccountSessionProvider accountSessionProvider;
    private final BrokerCallPolicy brokerCallPolicy;
    private final TradovateContractCache contractCache;
    private final TradovateConfig tradovateConfig;
    private final ObjectMapper objectMapper;
    private final RestClient demoClient;
    private final RestClient liveClient;
    private final Map<String, TradovateUserSyncClient> syncClients = new ConcurrentHashMap<>();

    public TradovateBrokerGateway(
            AccountSessionProvider accountSessionProvider,
            BrokerCallPolicy brokerCallPolicy,
            TradovateContractCache contractCache,
            TradovateConfig tradovateConfig,
            ObjectMapper objectMapper,
            @Qualifier("tradovateDemoRestClient") RestClient demoClient,
            @Qualifier("tradovateLiveRestClient") RestClient liveClient) {
        this.accountSessionProvider = accountSessionProvider;
        this.brokerCallPolicy = brokerCallPolicy;
        this.contractCache = contractCache;
        this.tradovateConfig = tradovateConfig;
        this.objectMapper = objectMapper;
        this.demoClient = demoClient;
        this.liveClient = liveClient;
    }

    // ========================
    // ORDERS
    // ========================

    @Override
    public String placeOrder(OrderIntent intent) {
        AccountSession session = accountSessionProvider.sessionFor(intent.getAccountId());
        TradovateOrderRequest request = new TradovateOrderRequest(
                session.accountSpec(),
                numericAccountId(session.accountId()),
                intent.getSide() == OrderSide.BUY ? "Buy" : "Sell",
                intent.getSymbol(),
                intent.getQuantity(),
                intent.getType() == OrderType.MARKET ? "Market" : "Limit",
                intent.getLimitPrice(),
                "Day",
                true);

        TradovateCommandResponse response = brokerCallPolicy.submit(
                session.accessToken(), "placeOrder", intent.isEmergency(), () -> post(session, request, intent));

        if (response == null || response.isFailure() || response.orderId() == null) {
            String reason = response == null ? "empty response" : response.failureDescription();
            log.warn("Tradovate rejected {} {} {} x{}: {}", intent.getPurpose(), intent.getSide(),
                    intent.getSymbol(), intent.getQuantity(), reason);
            throw new OrderRejectedException(intent.getSymbol(), intent.getPurpose(), reason);
        }
        log.info("Tradovate accepted {} {} {} x{} as order {}", intent.getPurpose(), intent.getSide(),
                intent.getSymbol(), intent.getQuantity(), response.orderId());
        return String.valueOf(response.orderId());
    }

    @Override
    public void cancelOrder(String accountId, String orderId) {
        AccountSession session = accountSessionProvider.sessionFor(accountId);
        Map<String, Object> body = Map.of("orderId", Long.parseLong(orderId), "isAutomated", true);
        TradovateCommandResponse response = brokerCallPolicy.submit(session.accessToken(), "cancelOrder", false, () -> {
            try {
                return client(session)
                        .post()
                        .uri("/order/cancelorder")
                        .headers(h -> h.setBearerAuth(session.accessToken()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(body)
                        .retrieve()
                        .body(TradovateCommandResponse.class);
            } catch (RestClientResponseException e) {
                if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                    throw new OrderNotFoundException(orderId);
                }
                throw new BrokerException("cancelOrder failed: HTTP " + e.getStatusCode().value(), e);
            } catch (RestClientException e) {
                throw new BrokerException("cancelOrder failed: " + e.getMessage(), e);
            }
        });
        if (response != null && response.isFailure()) {
            String reason = response.failureDescription();
            String lower = reason.toLowerCase();
            if (lower.contains("not found") || lower.contains("unknown order") || lower.contains("already")) {
                throw new OrderNotFoundException(orderId);
            }
            throw new BrokerException("cancelOrder " + orderId + " failed: " + reason);
        }
        log.info("Cancelled order {} on account {}", orderId, accountId);
    }

    // ========================
    // QUERIES
    // ========================

    @Override
    public BrokerPosition queryPosition(String accountId, String symbol) {
        AccountSession session = accountSessionProvider.sessionFor(accountId);
        long contractId = contractId(session, symbol);
        long numericAccount = numericAccountId(accountId);
        TradovatePosition[] positions = brokerCallPolicy.query(
                session.accessToken(), "queryPosition", () -> get(session, "/position/list", TradovatePosition[].class));
        if (positions == null) {
            return BrokerPosition.flat();
        }
        return Arrays.stream(positions)
                .filter(p -> p.accountId() == numericAccount && p.contractId() == contractId)
                .findFirst()
                .map(p -> BrokerPosition.of(p.netPos(), p.netPos() == 0 ? null : p.netPrice()))
                .orElseGet(BrokerPosition::flat);
    }

    @Override
    public List<String> queryOrders(String accountId, String symbol) {
        AccountSession session = accountSessionProvider.sessionFor(accountId);
        long contractId = contractId(session, symbol);
        long numericAccount = numericAccountId(accountId);
        return accountOrders(session, numericAccount).stream()
                .filter(o -> o.contractId() == contractId && o.isWorking())
                .map(o -> String.valueOf(o.id()))
                .toList();
    }

    @Override
    public List<BrokerFill> queryFills(String accountId, String symbol) {
        AccountSession session = accountSessionProvider.sessionFor(accountId);
        long contractId = contractId(session, symbol);
        long numericAccount = numericAccountId(accountId);
        Set<Long> orderIds = accountOrders(session, numericAccount).stream()
                .map(TradovateOrder::id)
                .collect(Collectors.toSet());
        TradovateFill[] fills = brokerCallPolicy.query(
                session.accessToken(), "queryFills", () -> get(session, "/fill/list", TradovateFill[].class));
        if (fills == null) {
            return List.of();
        }
        return Arrays.stream(fills)
                .filter(f -> f.contractId() == contractId && orderIds.contains(f.orderId()))
                .filter(f -> f.active() == null || f.active())
                .sorted(Comparator.comparing(TradovateFill::timestamp).thenComparingLong(TradovateFill::id))
                .map(TradovateBrokerGateway::toBrokerFill)
                .toList();
    }

    // ========================
    // PUSH EVENTS
    // ========================

    @Override
    public void subscribe(BrokerEventListener listener) {
        if (!tradovateConfig.isUserSyncEnabled()) {
            log.info("Tradovate user sync disabled; relying on confirmation polls and drift audits");
            return;
        }
        Map<String, List<AccountSession>> byToken = accountSessionProvider.allSessions().stream()
                .collect(Collectors.groupingBy(AccountSession::accessToken));
        byToken.forEach((token, sessions) -> syncClients.computeIfAbsent(token, t -> {
            TradingEnvironment environment = sessions.get(0).environment();
            List<Long> accountIds = new ArrayList<>();
            sessions.forEach(s -> accountIds.add(numericAccountId(s.accountId())));
            TradovateUserSyncClient client = new TradovateUserSyncClient(
                    tradovateConfig.wsUrl(environment),
                    token,
                    accountIds,
                    listener,
                    contractId -> contractCache.symbol(contractId, id -> lookupContract(sessions.get(0), id)),
                    objectMapper,
                    tradovateConfig);
            client.connect();
            return client;
        }));
    }

    @PreDestroy
    public void shutdown() {
        syncClients.values().forEach(TradovateUserSyncClient::close);
    }

    // ========================
    // HELPERS
    // ========================

    private TradovateCommandResponse post(AccountSession session, TradovateOrderRequest request, OrderIntent intent) {
        try {
            return client(session)
                    .post()
                    .uri("/order/placeorder")
                    .headers(h -> h.setBearerAuth(session.accessToken()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(TradovateCommandResponse.class);
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().is4xxClientError()) {
                throw new OrderRejectedException(
                        intent.getSymbol(),
                        intent.getPurpose(),
                        "HTTP " + e.getStatusCode().value() + " " + e.getResponseBodyAsString());
            }
            throw new BrokerException("placeOrder failed: HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new BrokerException("placeOrder outcome unknown: " + e.getMessage(), e);
        }
    }

    private <T> T get(AccountSession session, String path, Class<T> type) {
        try {
            return client(session)
                    .get()
                    .uri(path)
                    .headers(h -> h.setBearerAuth(session.accessToken()))
                    .retrieve()
                    .body(type);
        } catch (RestClientException e) {
            throw new BrokerException("GET " + path + " failed: " + e.getMessage(), e);
        }
    }

    private List<TradovateOrder> accountOrders(AccountSession session, long numericAccount) {
        TradovateOrder[] orders = brokerCallPolicy.query(
                session.accessToken(), "queryOrders", () -> get(session, "/order/list", TradovateOrder[].class));
        if (orders == null) {
            return List.of();
        }
        return Arrays.stream(orders).filter(o -> o.accountId() == numericAccount).toList();
    }

    private long contractId(AccountSession session, String symbol) {
        return contractCache.contractId(symbol, s -> brokerCallPolicy.query(
                session.accessToken(),
                "findContract",
                () -> {
                    try {
                        return client(session)
                                .get()
                                .uri(uri -> uri.path("/contract/find").queryParam("name", s).build())
                                .headers(h -> h.setBearerAuth(session.accessToken()))
                                .retrieve()
                                .body(TradovateContract.class);
                    } catch (RestClientException e) {
                        throw new BrokerException("contract lookup failed for " + s, e);
                    }
                }));
    }

    private TradovateContract lookupContract(AccountSession session, long contractId) {
        return brokerCallPolicy.query(session.accessToken(), "contractItem", () -> {
            try {
                return client(session)
                        .get()
                        .uri(uri -> uri.path("/contract/item").queryParam("id", contractId).build())
                        .headers(h -> h.setBearerAuth(session.accessToken()))
                        .retrieve()
                        .body(TradovateContract.class);
            } catch (RestClientException e) {
                throw new BrokerException("contract lookup failed for id " + contractId, e);
            }
        });
    }

    private RestClient client(AccountSession session) {
        return session.environment() == TradingEnvironment.LIVE ? liveClient : demoClient;
    }

    static BrokerFill toBrokerFill(TradovateFill fill) {
        return new BrokerFill(
                String.valueOf(fill.id()),
                String.valueOf(fill.orderId()),
                "Buy".equalsIgnoreCase(fill.action()) ? OrderSide.BUY : OrderSide.SELL,
                fill.qty(),
                fill.price(),
                fill.timestamp());
    }

    private static long numericAccountId(String accountId) {
        try {
            return Long.parseLong(accountId);
        } catch (NumberFormatException e) {
            throw new ValidationException("Tradovate account ids are numeric: " + accountId);
        }
    }
}
