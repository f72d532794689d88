package com.prodyna.pac.backend.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prodyna.pac.backend.api.dto.ErrorResponse;
import com.prodyna.pac.backend.exception.ErrorKind;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Writes the standard JSON error body from inside the security filter chain,
 * where the controller advice does not apply.
 *
 * @author PAC Team
 */
public class JsonErrorResponseWriter {

    private final ObjectMapper objectMapper;

    public JsonErrorResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletResponse response, ErrorKind kind, String message, String path) throws IOException {
        ErrorResponse error = ErrorResponse.of(kind, message, path);

        response.setStatus(kind.getStatus());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}
