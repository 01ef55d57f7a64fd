package com.example.vibescore.domain;

import java.util.Objects;

/**
 * A git author identity, keyed by the {@code (name, email)} pair.
 */
public class Identity {
    private final String name;
    private final String email;
    private int commitCount;

    public Identity(String name, String email) {
        this.name = name != null ? name : "";
        this.email = email != null ? email : "";
    }

    public static String keyOf(String name, String email) {
        return (name != null ? name : "") + "|" + (email != null ? email : "");
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    public String getKey() {
        return keyOf(name, email);
    }

    public int getCommitCount() {
        return commitCount;
    }

    public void recordCommit() {
        commitCount++;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Identity)) {
            return false;
        }
        Identity other = (Identity) o;
        return name.equals(other.name) && email.equals(other.email);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, email);
    }

    @Override
    public String toString() {
        return name + " <" + email + ">";
    }
}
