package com.example.vibescore.application;

import com.example.vibescore.domain.Answer;
import com.example.vibescore.domain.ConfidenceLevel;
import com.example.vibescore.domain.RecallBand;
import com.example.vibescore.domain.ScoreBreakdown;
import com.example.vibescore.domain.TrackScore;
import com.example.vibescore.domain.VibeRating;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ScoringEngineTest {

    private final ScoringEngine engine = new ScoringEngine();

    @Test
    void weightedScoreOfMixedAnswers() {
        List<Answer> answers = new ArrayList<>();
        add(answers, ConfidenceLevel.REMEMBER, true, 5);
        add(answers, ConfidenceLevel.FAMILIAR, true, 2);
        add(answers, ConfidenceLevel.UNCERTAIN, true, 2);
        add(answers, ConfidenceLevel.FOREIGN, true, 1);
        add(answers, ConfidenceLevel.FAMILIAR, false, 3);
        add(answers, ConfidenceLevel.FOREIGN, false, 7);

        TrackScore score = engine.scoreTrack(answers);

        assertEquals(27, score.score());
        assertEquals(10, score.selfTotal());
        assertEquals(10, score.otherTotal());
        assertEquals(3, score.falseMemory());
        assertEquals(7, score.correctlyRejected());
        assertEquals(0.3, score.forgetRate(), 1e-9);
        assertEquals(RecallBand.TYPICAL, score.band());
    }

    @Test
    void missingOwnershipGroupDoesNotDivideByZero() {
        List<Answer> answers = new ArrayList<>();
        add(answers, ConfidenceLevel.REMEMBER, false, 4);

        TrackScore score = engine.scoreTrack(answers);

        assertEquals(0, score.selfTotal());
        assertEquals(20, score.score());
        assertEquals(0, engine.scoreTrack(List.of()).score());
    }

    @Test
    void forgettingEverythingScoresFifty() {
        List<Answer> answers = new ArrayList<>();
        add(answers, ConfidenceLevel.FOREIGN, true, 6);

        assertEquals(50, engine.scoreTrack(answers).score());
    }

    @Test
    void velocityBonusIsCapped() {
        assertEquals(0, ScoringEngine.velocityBonus(0));
        assertEquals(9, ScoringEngine.velocityBonus(3));
        assertEquals(15, ScoringEngine.velocityBonus(5));
        assertEquals(15, ScoringEngine.velocityBonus(10));
    }

    @Test
    void compositeNeverExceedsOneHundred() {
        assertEquals(100, ScoringEngine.compositeScore(100, 100, 15));
        assertEquals(42, ScoringEngine.compositeScore(40, 40, 8));
        assertEquals(0, ScoringEngine.compositeScore(0, 0, 0));
    }

    @Test
    void breakdownCombinesTracksAndRating() {
        List<Answer> code = new ArrayList<>();
        add(code, ConfidenceLevel.FOREIGN, true, 4);
        add(code, ConfidenceLevel.REMEMBER, false, 4);
        List<Answer> comments = new ArrayList<>();
        add(comments, ConfidenceLevel.REMEMBER, true, 4);

        ScoreBreakdown breakdown = engine.score(code, comments, 2);

        assertEquals(70, breakdown.code().score());
        assertEquals(0, breakdown.comment().score());
        assertEquals(6, breakdown.velocityBonus());
        assertEquals(41, breakdown.total());
        assertEquals(VibeRating.VIBE_CODER, breakdown.rating());
    }

    private static void add(List<Answer> answers, ConfidenceLevel level, boolean self, int count) {
        for (int i = 0; i < count; i++) {
            answers.add(new Answer(level, self));
        }
    }
}
