package com.justtrades.broker;

import com.justtrades.config.TradovateConfig;
import com.justtrades.domain.model.AccountSession;
import com.justtrades.exception.ValidationException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Serves account sessions from {@code tradovate.accounts}.
 */
@Component
public class ConfiguredAccountSessionProvider implements AccountSessionProvider {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredAccountSessionProvider.class);

    private final Map<String, AccountSession> sessions = new LinkedHashMap<>();

    public ConfiguredAccountSessionProvider(TradovateConfig tradovateConfig) {
        for (TradovateConfig.Account account : tradovateConfig.getAccounts()) {
            sessions.put(
                    account.getAccountId(),
                    new AccountSession(
                            account.getAccountId(),
                            account.getAccountSpec(),
                            account.getAccessToken(),
                            account.getEnvironment()));
        }
        log.info("Loaded {} broker account session(s)", sessions.size());
    }

    @Override
    public AccountSession sessionFor(String accountId) {
        AccountSession session = sessions.get(accountId);
        if (session == null) {
            throw new ValidationException("Unknown broker account: " + accountId);
        }
        return session;
    }

    @Override
    public Collection<AccountSession> allSessions() {
        return sessions.values();
    }
}
