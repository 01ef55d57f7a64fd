package com.example.vibescore.application;

import com.example.vibescore.domain.Fingerprinted;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Drops fragments whose fingerprint equals, or positionally matches more than 80% of, the
 * fingerprint of a fragment accepted earlier. Quadratic in the pool size.
 */
@Component
public class FragmentDeduplicator {
    private static final Logger log = LogManager.getLogger(FragmentDeduplicator.class);

    static final double SIMILARITY_THRESHOLD = 0.8;

    public <T extends Fingerprinted> List<T> deduplicate(List<T> fragments) {
        List<T> accepted = new ArrayList<>();
        for (T candidate : fragments) {
            boolean duplicate = false;
            for (T existing : accepted) {
                if (isDuplicate(candidate.fingerprint(), existing.fingerprint())) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) {
                accepted.add(candidate);
            }
        }
        log.debug("Kept {} of {} fragments after deduplication", accepted.size(), fragments.size());
        return accepted;
    }

    public boolean isDuplicate(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        return Fingerprints.positionalMatchRatio(a, b) > SIMILARITY_THRESHOLD;
    }
}
