package com.example.vibescore.application;

import com.example.vibescore.domain.Identity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class IdentityCensusTest {

    private final IdentityCensus census = new IdentityCensus();

    @Test
    void countsCommitsPerNameAndEmailPair() {
        List<Identity> identities =
                census.count(
                        List.of(
                                "Ada|ada@example.com",
                                "Linus|linus@example.com",
                                "Ada|ada@example.com",
                                "Ada|ada@work.example",
                                "",
                                "Ada|ada@example.com"));

        assertEquals(3, identities.size());
        assertEquals("Ada|ada@example.com", identities.get(0).getKey());
        assertEquals(3, identities.get(0).getCommitCount());
        assertThat(identities)
                .extracting(Identity::getKey)
                .containsExactlyInAnyOrder("Ada|ada@example.com", "Linus|linus@example.com", "Ada|ada@work.example");
    }

    @Test
    void missingEmailIsTolerated() {
        List<Identity> identities = census.count(List.of("root"));

        assertEquals("root|", identities.get(0).getKey());
        assertEquals("", identities.get(0).getEmail());
    }
}
