package com.example.rental.service.exception;

import lombok.Getter;

/** Mirror write failed. Non-retryable failures send the outbox row straight to failed. */
@Getter
public class RemoteSinkException extends RuntimeException {
    private final boolean retryable;

    public RemoteSinkException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public RemoteSinkException(String message, boolean retryable) {
        this(message, retryable, null);
    }
}
