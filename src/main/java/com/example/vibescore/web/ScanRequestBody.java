package com.example.vibescore.web;

import java.util.List;

/**
 * @param identities selected {@code name|email} keys
 */
public record ScanRequestBody(List<String> identities) {}
