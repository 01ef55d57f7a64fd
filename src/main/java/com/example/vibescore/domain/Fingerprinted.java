package com.example.vibescore.domain;

public interface Fingerprinted {
    String fingerprint();
}
