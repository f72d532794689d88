package com.prodyna.pac.backend.exception;

/**
 * Classification of every error the backend reports to clients.
 * Each kind maps to exactly one HTTP status, so handlers inspect the kind
 * instead of the concrete exception type or its message.
 *
 * @author PAC Team
 */
public enum ErrorKind {

    BAD_REQUEST(400, "Bad Request"),
    UNAUTHORIZED(401, "Unauthorized"),
    NOT_FOUND(404, "Not Found"),
    CONFLICT(409, "Conflict"),
    UNSUPPORTED_MEDIA_TYPE(415, "Unsupported Media Type"),
    VALIDATION_FAILED(422, "Validation Failed"),
    UNEXPECTED(500, "Internal Server Error");

    private final int status;
    private final String title;

    ErrorKind(int status, String title) {
        this.status = status;
        this.title = title;
    }

    public int getStatus() {
        return status;
    }

    public String getTitle() {
        return title;
    }
}
