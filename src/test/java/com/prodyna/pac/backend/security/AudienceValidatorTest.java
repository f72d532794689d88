package com.prodyna.pac.backend.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.Jwt;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for AudienceValidator.
 */
@DisplayName("AudienceValidator Tests")
class AudienceValidatorTest {

    private final AudienceValidator validator = new AudienceValidator("demo-client");

    private static Jwt.Builder token() {
        return Jwt.withTokenValue("token")
                .header("alg", "RS256")
                .subject("alice")
                .issuedAt(Instant.now())
                .expiresAt(Instant.now().plusSeconds(300));
    }

    @Test
    @DisplayName("Client id in audience is accepted")
    void validate_AudienceContainsClient_Succeeds() {
        Jwt jwt = token().audience(List.of("account", "demo-client")).build();

        assertThat(validator.validate(jwt).hasErrors()).isFalse();
    }

    @Test
    @DisplayName("Client id as authorized party is accepted")
    void validate_AuthorizedParty_Succeeds() {
        Jwt jwt = token().audience(List.of("account")).claim("azp", "demo-client").build();

        assertThat(validator.validate(jwt).hasErrors()).isFalse();
    }

    @Test
    @DisplayName("Token for another client is rejected")
    void validate_OtherClient_Fails() {
        Jwt jwt = token().audience(List.of("other-client")).claim("azp", "other-client").build();

        assertThat(validator.validate(jwt).getErrors())
                .singleElement()
                .satisfies(error -> assertThat(error.getErrorCode()).isEqualTo("invalid_token"));
    }

    @Test
    @DisplayName("Token without audience is rejected")
    void validate_NoAudience_Fails() {
        Jwt jwt = token().build();

        assertThat(validator.validate(jwt).hasErrors()).isTrue();
    }
}
