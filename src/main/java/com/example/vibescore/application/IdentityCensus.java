package com.example.vibescore.application;

import com.example.vibescore.domain.Identity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts commits per author identity from {@code name|email} records.
 */
@Component
public class IdentityCensus {

    public List<Identity> count(List<String> authorRecords) {
        Map<String, Identity> identities = new LinkedHashMap<>();
        for (String record : authorRecords) {
            if (record == null || record.isBlank()) {
                continue;
            }
            String[] parts = record.split("\\|", -1);
            String name = parts[0];
            String email = parts.length > 1 ? parts[1] : "";
            identities.computeIfAbsent(Identity.keyOf(name, email), key -> new Identity(name, email))
                    .recordCommit();
        }
        List<Identity> sorted = new ArrayList<>(identities.values());
        sorted.sort(Comparator.comparingInt(Identity::getCommitCount).reversed());
        return sorted;
    }
}
