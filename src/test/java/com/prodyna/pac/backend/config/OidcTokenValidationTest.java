package com.prodyna.pac.backend.config;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtValidationException;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

import java.time.Instant;
import java.util.Date;

import static org.assertj.core.api.Assertions.*;

/**
 * Verifies signed tokens the way the application decoder does:
 * signature against the provider key, then expiry, issuer and audience.
 */
@DisplayName("OIDC Token Validation Tests")
class OidcTokenValidationTest {

    private static final String ISSUER = "http://localhost:8080/auth/realms/demo";
    private static final String CLIENT_ID = "demo-client";

    private static RSAKey providerKey;
    private static NimbusJwtDecoder decoder;

    @BeforeAll
    static void setUp() throws Exception {
        providerKey = new RSAKeyGenerator(2048).keyID("provider-key").generate();
        decoder = NimbusJwtDecoder.withPublicKey(providerKey.toRSAPublicKey()).build();
        decoder.setJwtValidator(OidcConfig.tokenValidator(ISSUER, CLIENT_ID));
    }

    private static JWTClaimsSet.Builder claims() {
        Instant now = Instant.now();
        return new JWTClaimsSet.Builder()
                .issuer(ISSUER)
                .subject("alice")
                .audience(CLIENT_ID)
                .issueTime(Date.from(now))
                .expirationTime(Date.from(now.plusSeconds(300)));
    }

    private static String sign(RSAKey key, JWTClaimsSet claims) throws JOSEException {
        SignedJWT jwt = new SignedJWT(
                new JWSHeader.Builder(JWSAlgorithm.RS256).keyID(key.getKeyID()).build(),
                claims);
        jwt.sign(new RSASSASigner(key));
        return jwt.serialize();
    }

    @Test
    @DisplayName("Token signed by the provider for this client is accepted")
    void decode_ValidToken_ReturnsSubject() throws Exception {
        Jwt jwt = decoder.decode(sign(providerKey, claims().build()));

        assertThat(jwt.getSubject()).isEqualTo("alice");
        assertThat(jwt.getAudience()).containsExactly(CLIENT_ID);
    }

    @Test
    @DisplayName("Token for another audience is rejected")
    void decode_WrongAudience_Rejected() throws Exception {
        String token = sign(providerKey, claims().audience("other-client").build());

        assertThatThrownBy(() -> decoder.decode(token))
                .isInstanceOf(JwtValidationException.class)
                .hasMessageContaining(CLIENT_ID);
    }

    @Test
    @DisplayName("Token from another issuer is rejected")
    void decode_WrongIssuer_Rejected() throws Exception {
        String token = sign(providerKey, claims().issuer("http://evil.example.com/realms/demo").build());

        assertThatThrownBy(() -> decoder.decode(token))
                .isInstanceOf(JwtValidationException.class);
    }

    @Test
    @DisplayName("Expired token is rejected")
    void decode_Expired_Rejected() throws Exception {
        Instant past = Instant.now().minusSeconds(600);
        String token = sign(providerKey, claims()
                .issueTime(Date.from(past))
                .expirationTime(Date.from(past.plusSeconds(300)))
                .build());

        assertThatThrownBy(() -> decoder.decode(token))
                .isInstanceOf(JwtValidationException.class);
    }

    @Test
    @DisplayName("Token signed with an unknown key is rejected")
    void decode_ForeignKey_Rejected() throws Exception {
        RSAKey foreignKey = new RSAKeyGenerator(2048).keyID("provider-key").generate();
        String token = sign(foreignKey, claims().build());

        assertThatThrownBy(() -> decoder.decode(token))
                .isInstanceOf(BadJwtException.class);
    }

    @Test
    @DisplayName("Malformed token is rejected")
    void decode_Malformed_Rejected() {
        assertThatThrownBy(() -> decoder.decode("not.a.jwt"))
                .isInstanceOf(BadJwtException.class);
    }
}
