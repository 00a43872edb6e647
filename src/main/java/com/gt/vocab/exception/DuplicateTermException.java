package com.gt.vocab.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when an update would give a card the normalized term of another card
@ResponseStatus(value = HttpStatus.CONFLICT)
public class DuplicateTermException extends RuntimeException {

    public DuplicateTermException(String msg) {
        super(msg);
    }

    public DuplicateTermException(String msg, Exception ex) {
        super(msg, ex);
    }
}
