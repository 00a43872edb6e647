package com.gt.vocab.exception;

// Raised by content providers; callers fall back to the local provider instead of surfacing it
public class AiProviderException extends RuntimeException {

    public AiProviderException(String msg) {
        super(msg);
    }

    public AiProviderException(String msg, Exception ex) {
        super(msg, ex);
    }
}
