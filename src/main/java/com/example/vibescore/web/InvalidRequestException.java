package com.example.vibescore.web;

/**
 * Raised when a request body is missing fields the API requires.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
