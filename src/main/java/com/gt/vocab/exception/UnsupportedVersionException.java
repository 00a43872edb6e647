package com.gt.vocab.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class UnsupportedVersionException extends RuntimeException {

    private final String schemaVersion;

    public UnsupportedVersionException(String schemaVersion) {
        super("Unsupported schemaVersion: " + schemaVersion);
        this.schemaVersion = schemaVersion;
    }

    public String getSchemaVersion() {
        return schemaVersion;
    }
}
