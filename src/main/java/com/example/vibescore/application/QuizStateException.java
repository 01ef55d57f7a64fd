package com.example.vibescore.application;

/**
 * An operation that does not fit the session's current phase or answer position.
 */
public class QuizStateException extends RuntimeException {
    public QuizStateException(String message) {
        super(message);
    }
}
