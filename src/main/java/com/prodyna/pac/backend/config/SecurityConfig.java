package com.prodyna.pac.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prodyna.pac.backend.security.JsonAuthenticationEntryPoint;
import com.prodyna.pac.backend.security.JsonContentTypeFilter;
import com.prodyna.pac.backend.security.JsonErrorResponseWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Security configuration for the PAC backend.
 *
 * Filter order for every request:
 * 1. JSON content-type check on POST and PUT (415 on mismatch)
 * 2. Bearer token authentication against the OpenID Connect provider
 * 3. Authorization rules below (401 when a token is required but missing or invalid)
 *
 * Public Endpoints (no token required):
 * - GET / (liveness)
 * - /metrics, /health
 * - GET and DELETE /{entities}/{id}, unless pac.security.protect-item-routes is set
 *
 * All other endpoints require a valid bearer token.
 *
 * @author PAC Team
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final Logger logger = LoggerFactory.getLogger(SecurityConfig.class);

    private static final String ITEM_ROUTE = "/*/{id:[0-9]+}";

    @Value("${pac.security.protect-item-routes:false}")
    private boolean protectItemRoutes;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http, ObjectMapper objectMapper) throws Exception {
        JsonErrorResponseWriter errorWriter = new JsonErrorResponseWriter(objectMapper);
        AuthenticationEntryPoint entryPoint = new JsonAuthenticationEntryPoint(errorWriter);

        if (!protectItemRoutes) {
            logger.warn("GET and DELETE on {} do not require a bearer token; "
                    + "set pac.security.protect-item-routes=true to protect them", ITEM_ROUTE);
        }

        http
            .csrf(csrf -> csrf.disable())

            .authorizeHttpRequests(auth -> {
                auth.requestMatchers(HttpMethod.GET, "/").permitAll()
                    .requestMatchers("/metrics", "/health", "/health/**", "/error").permitAll();

                if (!protectItemRoutes) {
                    auth.requestMatchers(HttpMethod.GET, ITEM_ROUTE).permitAll()
                        .requestMatchers(HttpMethod.DELETE, ITEM_ROUTE).permitAll();
                }

                auth.anyRequest().authenticated();
            })

            .sessionManagement(session -> session
                .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            .oauth2ResourceServer(oauth2 -> oauth2
                .jwt(Customizer.withDefaults())
                .authenticationEntryPoint(entryPoint)
            )

            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint(entryPoint)
            )

            .addFilterBefore(new JsonContentTypeFilter(errorWriter), BearerTokenAuthenticationFilter.class);

        return http.build();
    }
}
