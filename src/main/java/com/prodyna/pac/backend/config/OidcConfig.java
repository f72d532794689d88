package com.prodyna.pac.backend.config;

import com.prodyna.pac.backend.security.AudienceValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtDecoders;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

/**
 * OpenID Connect provider configuration.
 *
 * The decoder is built from the provider's discovery document, fetched once at
 * startup from {issuer}/.well-known/openid-configuration. If the provider
 * cannot be reached the bean cannot be created and the application does not
 * start.
 *
 * Token verification:
 * - Signature against the provider's JWK set (re-fetched for unknown key ids)
 * - exp / nbf against the current time, with the default clock skew
 * - iss equal to the configured issuer
 * - aud containing the configured client id (or azp equal to it)
 *
 * @author PAC Team
 */
@Configuration
public class OidcConfig {

    private static final Logger logger = LoggerFactory.getLogger(OidcConfig.class);

    @Value("${pac.oidc.issuer-uri}")
    private String issuerUri;

    @Value("${pac.oidc.client-id}")
    private String clientId;

    @Bean
    public JwtDecoder jwtDecoder() {
        logger.info("Discovering OpenID Connect provider at {} for client {}", issuerUri, clientId);

        NimbusJwtDecoder decoder = JwtDecoders.fromIssuerLocation(issuerUri);
        decoder.setJwtValidator(tokenValidator(issuerUri, clientId));

        logger.info("OpenID Connect provider {} discovered", issuerUri);
        return decoder;
    }

    /**
     * Validator applied to every decoded token.
     *
     * @param issuer Expected issuer
     * @param clientId Expected audience
     * @return Combined timestamp, issuer and audience validator
     */
    public static OAuth2TokenValidator<Jwt> tokenValidator(String issuer, String clientId) {
        return new DelegatingOAuth2TokenValidator<>(
                JwtValidators.createDefaultWithIssuer(issuer),
                new AudienceValidator(clientId)
        );
    }
}
