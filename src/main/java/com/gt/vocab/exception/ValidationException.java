package com.gt.vocab.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.Map;

// Thrown when request input is rejected before anything is read or written
@ResponseStatus(value = HttpStatus.UNPROCESSABLE_ENTITY)
public class ValidationException extends RuntimeException {

    private final String field;
    private final Map<String, Object> details;

    public ValidationException(String field, String msg) {
        this(field, msg, Map.of());
    }

    public ValidationException(String field, String msg, Map<String, Object> details) {
        super(msg);
        this.field = field;
        this.details = details;
    }

    public String getField() {
        return field;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
