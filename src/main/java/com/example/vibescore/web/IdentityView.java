package com.example.vibescore.web;

import com.example.vibescore.domain.Identity;

public record IdentityView(String key, String name, String email, int commits) {
    public static IdentityView of(Identity identity) {
        return new IdentityView(identity.getKey(), identity.getName(), identity.getEmail(), identity.getCommitCount());
    }
}
