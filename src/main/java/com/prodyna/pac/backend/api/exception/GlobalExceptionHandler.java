package com.prodyna.pac.backend.api.exception;

import com.prodyna.pac.backend.api.dto.ErrorResponse;
import com.prodyna.pac.backend.exception.ErrorKind;
import com.prodyna.pac.backend.exception.ResourceNotFoundException;
import com.prodyna.pac.backend.exception.StoreException;
import com.prodyna.pac.backend.exception.ValidationFailedException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global exception handler for the PAC API.
 * Converts store errors (by kind) and framework errors into standardized error responses.
 * Internal error details are logged, never returned.
 *
 * @author PAC Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String UNEXPECTED_MESSAGE = "An unexpected error occurred. Please try again later.";

    /**
     * Handle every classified store error.
     * NOT_FOUND → 404, VALIDATION_FAILED → 422 with field violations,
     * CONFLICT → 409, UNEXPECTED → 500 without internal details.
     */
    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreException(
            StoreException ex,
            HttpServletRequest request
    ) {
        ErrorKind kind = ex.getKind();

        if (kind == ErrorKind.UNEXPECTED) {
            logger.error("Unexpected store error on {} {}", request.getMethod(), request.getRequestURI(), ex);
            return respond(ErrorResponse.of(kind, UNEXPECTED_MESSAGE, request.getRequestURI()));
        }

        logger.warn("{} on {} {}: {}", kind, request.getMethod(), request.getRequestURI(), ex.getMessage());

        ErrorResponse error = ErrorResponse.of(kind, ex.getMessage(), request.getRequestURI());
        if (ex instanceof ValidationFailedException) {
            error.addDetail("violations", ((ValidationFailedException) ex).getViolations());
        } else if (ex instanceof ResourceNotFoundException) {
            ResourceNotFoundException notFound = (ResourceNotFoundException) ex;
            error.addDetail("resourceType", notFound.getResourceType());
            error.addDetail("resourceId", notFound.getResourceId());
        }

        return respond(error);
    }

    /**
     * Handle unreadable request bodies (malformed JSON, wrong value types).
     * Returns 400 BAD REQUEST.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMessageNotReadable(
            HttpMessageNotReadableException ex,
            HttpServletRequest request
    ) {
        logger.warn("Malformed request body on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());

        return respond(ErrorResponse.of(ErrorKind.BAD_REQUEST, "Malformed JSON request body", request.getRequestURI()));
    }

    /**
     * Handle path variables that do not convert, e.g. an id beyond the range of a long.
     * Returns 400 BAD REQUEST.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid value for {} on {}: {}", ex.getName(), request.getRequestURI(), ex.getValue());

        return respond(ErrorResponse.of(ErrorKind.BAD_REQUEST,
                "Invalid value for parameter '" + ex.getName() + "'", request.getRequestURI()));
    }

    /**
     * Handle requests whose body is not JSON.
     * Returns 415 UNSUPPORTED MEDIA TYPE.
     */
    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaTypeNotSupported(
            HttpMediaTypeNotSupportedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Unsupported content type on {}: {}", request.getRequestURI(), ex.getContentType());

        return respond(ErrorResponse.of(ErrorKind.UNSUPPORTED_MEDIA_TYPE,
                "Content-Type must be application/json", request.getRequestURI()));
    }

    /**
     * Handle paths no route matches, e.g. a non-numeric id.
     * Returns 404 NOT FOUND.
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFound(
            NoResourceFoundException ex,
            HttpServletRequest request
    ) {
        logger.debug("No route for {} {}", request.getMethod(), request.getRequestURI());

        return respond(ErrorResponse.of(ErrorKind.NOT_FOUND, "No such resource", request.getRequestURI()));
    }

    /**
     * Handle unsupported HTTP methods on an existing route.
     * Returns 405 METHOD NOT ALLOWED.
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex,
            HttpServletRequest request
    ) {
        logger.debug("Method {} not supported on {}", ex.getMethod(), request.getRequestURI());

        ErrorResponse error = new ErrorResponse(
                HttpStatus.METHOD_NOT_ALLOWED.value(),
                "Method Not Allowed",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(error);
    }

    /**
     * Handle requests accepting no representation the API produces.
     * Returns 406 NOT ACCEPTABLE without a body, since none could be written.
     */
    @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
    public ResponseEntity<Void> handleMediaTypeNotAcceptable(
            HttpMediaTypeNotAcceptableException ex,
            HttpServletRequest request
    ) {
        logger.debug("Not acceptable on {}: {}", request.getRequestURI(), request.getHeader("Accept"));

        return ResponseEntity.status(HttpStatus.NOT_ACCEPTABLE).build();
    }

    /**
     * Handle all other uncaught exceptions.
     * Client errors raised by Spring MVC keep their own 4xx status; anything
     * else returns 500 INTERNAL SERVER ERROR.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        if (ex instanceof org.springframework.web.ErrorResponse) {
            HttpStatusCode status = ((org.springframework.web.ErrorResponse) ex).getStatusCode();
            if (status.is4xxClientError()) {
                logger.warn("Client error {} on {} {}: {}",
                        status.value(), request.getMethod(), request.getRequestURI(), ex.getMessage());
                return clientError(status, ex, request);
            }
        }

        logger.error("Unexpected error: ", ex);

        return respond(ErrorResponse.of(ErrorKind.UNEXPECTED, UNEXPECTED_MESSAGE, request.getRequestURI()));
    }

    private static ResponseEntity<ErrorResponse> clientError(HttpStatusCode status, Exception ex, HttpServletRequest request) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String reason = resolved != null ? resolved.getReasonPhrase() : "Client Error";
        String detail = ((org.springframework.web.ErrorResponse) ex).getBody().getDetail();

        ErrorResponse error = new ErrorResponse(
                status.value(),
                reason,
                detail != null ? detail : reason,
                request.getRequestURI()
        );
        return ResponseEntity.status(status).body(error);
    }

    private static ResponseEntity<ErrorResponse> respond(ErrorResponse error) {
        return ResponseEntity.status(error.getStatus()).body(error);
    }
}
