package com.prodyna.pac.backend.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * With item route protection enabled, single-entity reads and deletes need a token too.
 */
@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:h2:mem:protecteddb;DB_CLOSE_DELAY=-1",
    "spring.datasource.driver-class-name=org.h2.Driver",
    "spring.jpa.hibernate.ddl-auto=create-drop",
    "pac.security.protect-item-routes=true"
})
@AutoConfigureMockMvc
@DisplayName("Protected Item Routes API Tests")
class ProtectedItemRoutesApiTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JwtDecoder jwtDecoder;

    @Test
    @DisplayName("GET and DELETE by id without a token return 401")
    void itemRoutes_NoToken_Return401() throws Exception {
        mockMvc.perform(get("/locations/{id}", 1))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(delete("/rooms/{id}", 1))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("GET by id with a token reaches the store")
    void itemRoute_WithToken_Returns404ForUnknownId() throws Exception {
        mockMvc.perform(get("/locations/{id}", 1).with(jwt()))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Liveness stays public")
    void root_StaysPublic() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isNoContent());
    }
}
