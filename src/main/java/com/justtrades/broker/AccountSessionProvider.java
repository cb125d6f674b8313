package com.justtrades.broker;

import com.justtrades.domain.model.AccountSession;
import java.util.Collection;

/**
 * Supplies broker sessions (tokens, environment) for accounts. Credential
 * acquisition and refresh live behind this interface.
 */
public interface AccountSessionProvider {

    /**
     * @throws com.justtrades.exception.ValidationException if the account is unknown
     */
    AccountSession sessionFor(String accountId);

    Collection<AccountSession> allSessions();
}
