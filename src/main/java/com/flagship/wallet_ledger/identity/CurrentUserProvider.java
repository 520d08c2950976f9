package com.flagship.wallet_ledger.identity;

import java.util.UUID;

/**
 * Identity of the acting user, as established by the upstream authenticator.
 */
public interface CurrentUserProvider {

    /**
     * @throws UnauthenticatedException if the current request carries no usable identity
     */
    UUID currentUserId();
}
