package com.prodyna.pac.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the PAC conference planning backend.
 *
 * Architecture:
 * - API Layer: REST controllers mapping request DTOs to entities and back
 * - Store Layer: validation, reference resolution and persistence per entity type
 * - Data Access Layer: Spring Data JPA repositories with explicit entity graphs
 * - Security: OAuth2 resource server verifying OpenID Connect bearer tokens
 * - Observability: Micrometer metrics exposed for Prometheus at /metrics
 *
 * @author PAC Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
public class PacBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(PacBackendApplication.class, args);
    }
}
