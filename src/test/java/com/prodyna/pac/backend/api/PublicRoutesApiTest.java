package com.prodyna.pac.backend.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.actuate.observability.AutoConfigureObservability;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Liveness, health and metrics routes are reachable without a token.
 */
@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:h2:mem:publicdb;DB_CLOSE_DELAY=-1",
    "spring.datasource.driver-class-name=org.h2.Driver",
    "spring.jpa.hibernate.ddl-auto=create-drop"
})
@AutoConfigureMockMvc
@AutoConfigureObservability
@DisplayName("Public Routes API Tests")
class PublicRoutesApiTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JwtDecoder jwtDecoder;

    @Test
    @DisplayName("GET / returns 204")
    void root_Returns204() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("GET /health returns UP")
    void health_ReturnsUp() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    @DisplayName("GET /metrics exposes store metrics in Prometheus format")
    void metrics_ExposesStoreOperations() throws Exception {
        // Given
        mockMvc.perform(get("/talks/{id}", 4711))
                .andExpect(status().isNotFound());

        // When / Then
        mockMvc.perform(get("/metrics"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("pac_store_operation_seconds_count")))
                .andExpect(content().string(containsString("outcome=\"NOT_FOUND\"")));
    }
}
