package com.example.vibescore.application;

public class RepositoryUnavailableException extends ScanAbortedException {
    public RepositoryUnavailableException(String location, Throwable cause) {
        super("No git repository found at " + location, cause);
    }
}
