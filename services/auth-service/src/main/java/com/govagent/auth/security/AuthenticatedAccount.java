package com.govagent.auth.security;

import lombok.Value;

import java.security.Principal;
import java.util.UUID;

/**
 * AuthenticatedAccount - Identity asserted by a verified session token.
 * 
 * Installed as the Spring Security principal by {@link BearerTokenFilter}.
 * The id comes from the token subject; loginName and email are the
 * denormalised copies taken at issuance and may be stale if the account
 * changed since.
 */
@Value
public class AuthenticatedAccount implements Principal {
    UUID id;
    String loginName;
    String email;

    @Override
    public String getName() {
        return id.toString();
    }
}
