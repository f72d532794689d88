package com.prodyna.pac.backend.exception;

import java.util.Objects;

/**
 * A single violated constraint on an entity field.
 *
 * @author PAC Team
 */
public class FieldViolation {

    private final String field;
    private final String message;

    public FieldViolation(String field, String message) {
        this.field = field;
        this.message = message;
    }

    public String getField() {
        return field;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldViolation)) {
            return false;
        }
        FieldViolation that = (FieldViolation) o;
        return Objects.equals(field, that.field) && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, message);
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
