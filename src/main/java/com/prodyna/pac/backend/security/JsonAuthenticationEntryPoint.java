package com.prodyna.pac.backend.security;

import com.prodyna.pac.backend.exception.ErrorKind;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.InsufficientAuthenticationException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;

/**
 * Answers unauthenticated requests with 401 and the standard JSON error body.
 * The reason a token was rejected is logged, never returned to the client.
 *
 * @author PAC Team
 */
public class JsonAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private static final Logger logger = LoggerFactory.getLogger(JsonAuthenticationEntryPoint.class);

    private static final String MESSAGE = "A valid bearer token is required";

    private final JsonErrorResponseWriter errorWriter;

    public JsonAuthenticationEntryPoint(JsonErrorResponseWriter errorWriter) {
        this.errorWriter = errorWriter;
    }

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException
    ) throws IOException {

        if (authException instanceof InsufficientAuthenticationException) {
            logger.debug("No bearer token on {} {}", request.getMethod(), request.getRequestURI());
        } else {
            logger.warn("Rejected bearer token on {} {}: {}",
                    request.getMethod(), request.getRequestURI(), authException.getMessage());
        }

        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        errorWriter.write(response, ErrorKind.UNAUTHORIZED, MESSAGE, request.getRequestURI());
    }
}
