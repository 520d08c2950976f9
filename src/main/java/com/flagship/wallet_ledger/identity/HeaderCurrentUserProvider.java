package com.flagship.wallet_ledger.identity;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Reads the acting user from the {@code X-User-Id} header, which the gateway in
 * front of this service sets after authenticating the caller.
 */
@Component
@RequiredArgsConstructor
public class HeaderCurrentUserProvider implements CurrentUserProvider {

    public static final String USER_ID_HEADER = "X-User-Id";

    private final HttpServletRequest request;

    @Override
    public UUID currentUserId() {
        String header = request.getHeader(USER_ID_HEADER);
        if (header == null || header.isBlank()) {
            throw new UnauthenticatedException("Missing " + USER_ID_HEADER + " header");
        }
        try {
            return UUID.fromString(header.trim());
        } catch (IllegalArgumentException e) {
            throw new UnauthenticatedException("Malformed " + USER_ID_HEADER + " header");
        }
    }
}
