package com.justtrades.config;

import com.justtrades.domain.enums.TradingEnvironment;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Tradovate connection settings bound from {@code tradovate.*}.
 *
 * <p>Accounts are listed here with their access tokens. Token acquisition and
 * refresh belong to the credential service that writes these values; the engine
 * only reads them. Several accounts may reference the same token.
 */
@Configuration
@ConfigurationProperties(prefix = "tradovate")
@Getter
@Setter
public class TradovateConfig {

    private String demoUrl = "https://demo.tradovateapi.com/v1";
    private String liveUrl = "https://live.tradovateapi.com/v1";
    private String demoWsUrl = "wss://demo.tradovateapi.com/v1/websocket";
    private String liveWsUrl = "wss://live.tradovateapi.com/v1/websocket";

    private Duration connectTimeout = Duration.ofSeconds(2);
    private Duration readTimeout = Duration.ofSeconds(3);

    /** Open the user-sync WebSocket for push events. Disable to run on polling only. */
    private boolean userSyncEnabled = true;

    private Duration heartbeatInterval = Duration.ofMillis(2500);
    private Duration reconnectDelay = Duration.ofSeconds(3);

    private List<Account> accounts = new ArrayList<>();

    /** REST client for the demo environment, shared by all demo sessions. */
    @Bean("tradovateDemoRestClient")
    public RestClient tradovateDemoRestClient(RestClient.Builder builder) {
        return buildClient(builder, demoUrl);
    }

    /** REST client for the live environment, shared by all live sessions. */
    @Bean("tradovateLiveRestClient")
    public RestClient tradovateLiveRestClient(RestClient.Builder builder) {
        return buildClient(builder, liveUrl);
    }

    private RestClient buildClient(RestClient.Builder builder, String baseUrl) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return builder.clone()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }

    public String wsUrl(TradingEnvironment environment) {
        return environment == TradingEnvironment.LIVE ? liveWsUrl : demoWsUrl;
    }

    @Getter
    @Setter
    public static class Account {
        private String accountId;
        private String accountSpec;
        private String accessToken;
        private TradingEnvironment environment = TradingEnvironment.DEMO;
    }
}
