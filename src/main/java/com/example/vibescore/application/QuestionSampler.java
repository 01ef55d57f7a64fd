package com.example.vibescore.application;

import com.example.vibescore.domain.QuizTrack;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Builds a question sequence that leans 60/40 towards the user's own fragments.
 */
@Component
public class QuestionSampler {
    public static final int MIN_QUESTIONS = 3;
    static final double SELF_SHARE = 0.6;

    private final Random random;

    public QuestionSampler(Random random) {
        this.random = random;
    }

    /**
     * Slot counts for a target size; an undersized other-pool hands its slots back to self.
     */
    public static Shares shares(int target, int selfPoolSize, int otherPoolSize) {
        int self = Math.min((int) Math.ceil(target * SELF_SHARE), selfPoolSize);
        int other = Math.min(target - self, otherPoolSize);
        int finalSelf = Math.min(target - other, selfPoolSize);
        return new Shares(finalSelf, other);
    }

    public <T> List<T> sample(QuizTrack track, List<T> selfPool, List<T> otherPool, int target) {
        Shares shares = shares(target, selfPool.size(), otherPool.size());
        List<T> questions = new ArrayList<>(shares.total());
        questions.addAll(shuffled(selfPool).subList(0, shares.self()));
        questions.addAll(shuffled(otherPool).subList(0, shares.other()));
        Collections.shuffle(questions, random);
        if (questions.size() < MIN_QUESTIONS) {
            throw new InsufficientMaterialException(track, questions.size(), MIN_QUESTIONS);
        }
        return questions;
    }

    private <T> List<T> shuffled(List<T> pool) {
        List<T> copy = new ArrayList<>(pool);
        Collections.shuffle(copy, random);
        return copy;
    }

    public record Shares(int self, int other) {
        public int total() {
            return self + other;
        }
    }
}
