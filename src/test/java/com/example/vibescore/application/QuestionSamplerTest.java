package com.example.vibescore.application;

import com.example.vibescore.domain.QuizTrack;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QuestionSamplerTest {

    private final QuestionSampler sampler = new QuestionSampler(new Random(3));

    @Test
    void sharesLeanSixtyFortyTowardsSelf() {
        QuestionSampler.Shares shares = QuestionSampler.shares(10, 50, 50);

        assertEquals(6, shares.self());
        assertEquals(4, shares.other());
    }

    @Test
    void smallSelfPoolIsToppedUpFromOthers() {
        QuestionSampler.Shares shares = QuestionSampler.shares(10, 2, 20);

        assertEquals(2, shares.self());
        assertEquals(8, shares.other());
        assertEquals(10, shares.total());
    }

    @Test
    void smallOtherPoolHandsSlotsBackToSelf() {
        QuestionSampler.Shares shares = QuestionSampler.shares(10, 20, 1);

        assertEquals(9, shares.self());
        assertEquals(1, shares.other());
    }

    @Test
    void sampleDrawsFromBothPoolsWithoutRepeats() {
        List<String> self = pool("self", 2);
        List<String> other = pool("other", 20);

        List<String> questions = sampler.sample(QuizTrack.CODE, self, other, 10);

        assertThat(questions).hasSize(10).doesNotHaveDuplicates().containsAll(self);
        assertThat(questions).filteredOn(q -> q.startsWith("other")).hasSize(8);
    }

    @Test
    void sampleNeverExceedsTarget() {
        List<String> questions = sampler.sample(QuizTrack.COMMENT, pool("self", 30), pool("other", 30), 10);

        assertThat(questions).hasSize(10);
    }

    @Test
    void shortfallBelowThreeIsFatal() {
        InsufficientMaterialException e =
                assertThrows(
                        InsufficientMaterialException.class,
                        () -> sampler.sample(QuizTrack.COMMENT, pool("self", 1), pool("other", 1), 10));

        assertEquals(QuizTrack.COMMENT, e.getTrack());
        assertEquals(2, e.getAvailable());
        assertEquals(3, e.getRequired());
        assertThat(e.getMessage()).contains("comment");
    }

    @Test
    void threeQuestionsAreEnough() {
        assertThat(sampler.sample(QuizTrack.CODE, pool("self", 3), List.of(), 10)).hasSize(3);
    }

    private static List<String> pool(String prefix, int size) {
        List<String> pool = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            pool.add(prefix + i);
        }
        return pool;
    }
}
