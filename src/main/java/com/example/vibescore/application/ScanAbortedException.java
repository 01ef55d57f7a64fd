package com.example.vibescore.application;

/**
 * Base type of the conditions that stop a scan before any quiz is started.
 */
public abstract class ScanAbortedException extends RuntimeException {
    protected ScanAbortedException(String message) {
        super(message);
    }

    protected ScanAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
