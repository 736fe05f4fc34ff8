package com.agora.exception;

/**
 * A content source could not produce an utterance. The engine skips the turn and retries later.
 */
public class TransientContentException extends RuntimeException {

    public TransientContentException(String message) {
        super(message);
    }

    public TransientContentException(String message, Throwable cause) {
        super(message, cause);
    }
}
