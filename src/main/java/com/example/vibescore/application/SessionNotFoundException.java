package com.example.vibescore.application;

import java.util.UUID;

public class SessionNotFoundException extends RuntimeException {
    public SessionNotFoundException(UUID id) {
        super("Quiz session not found: " + id);
    }
}
