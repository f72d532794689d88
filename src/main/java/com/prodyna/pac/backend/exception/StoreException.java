package com.prodyna.pac.backend.exception;

/**
 * Base class of all errors raised by the entity stores.
 * Store failures are classified once, at the store boundary, so callers never
 * have to look at the underlying persistence exception.
 *
 * @author PAC Team
 */
public class StoreException extends RuntimeException {

    private final ErrorKind kind;

    public StoreException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StoreException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
