package com.gt.vocab.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a json column or payload cannot be converted to or from its model type
@ResponseStatus(value = HttpStatus.INTERNAL_SERVER_ERROR)
public class MappingException extends RuntimeException {

    public MappingException(String errMsg)  {
        super(errMsg);
    }

    public MappingException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
