package com.example.vibescore.application;

public class NoHistoryException extends ScanAbortedException {
    public NoHistoryException(String message) {
        super(message);
    }

    public NoHistoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
