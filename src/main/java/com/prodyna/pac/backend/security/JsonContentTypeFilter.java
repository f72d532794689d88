package com.prodyna.pac.backend.security;

import com.prodyna.pac.backend.exception.ErrorKind;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Rejects mutating requests (POST, PUT) whose body is not declared as JSON.
 *
 * Runs ahead of bearer token authentication, so a request with the wrong
 * content type is answered 415 whether or not it carries a valid token.
 *
 * @author PAC Team
 */
public class JsonContentTypeFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(JsonContentTypeFilter.class);

    private final JsonErrorResponseWriter errorWriter;

    public JsonContentTypeFilter(JsonErrorResponseWriter errorWriter) {
        this.errorWriter = errorWriter;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String method = request.getMethod();
        return !HttpMethod.POST.matches(method) && !HttpMethod.PUT.matches(method);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String contentType = request.getContentType();

        if (isJson(contentType)) {
            filterChain.doFilter(request, response);
            return;
        }

        logger.debug("Rejecting {} {} with content type: {}", request.getMethod(), request.getRequestURI(), contentType);
        errorWriter.write(response, ErrorKind.UNSUPPORTED_MEDIA_TYPE,
                "Content-Type must be " + MediaType.APPLICATION_JSON_VALUE, request.getRequestURI());
    }

    static boolean isJson(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return false;
        }
        try {
            return MediaType.APPLICATION_JSON.equalsTypeAndSubtype(MediaType.parseMediaType(contentType));
        } catch (InvalidMediaTypeException e) {
            return false;
        }
    }
}
