package com.prodyna.pac.backend.security;

import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.List;

/**
 * Accepts a token only if it was issued for this client: the client id is
 * one of the audiences, or it is the authorized party ({@code azp}).
 *
 * @author PAC Team
 */
public class AudienceValidator implements OAuth2TokenValidator<Jwt> {

    private static final String AUTHORIZED_PARTY_CLAIM = "azp";

    private final String clientId;

    public AudienceValidator(String clientId) {
        this.clientId = clientId;
    }

    @Override
    public OAuth2TokenValidatorResult validate(Jwt token) {
        List<String> audience = token.getAudience();
        if (audience != null && audience.contains(clientId)) {
            return OAuth2TokenValidatorResult.success();
        }
        if (clientId.equals(token.getClaimAsString(AUTHORIZED_PARTY_CLAIM))) {
            return OAuth2TokenValidatorResult.success();
        }

        OAuth2Error error = new OAuth2Error(OAuth2ErrorCodes.INVALID_TOKEN,
                "The token was not issued for client " + clientId, null);
        return OAuth2TokenValidatorResult.failure(error);
    }
}
