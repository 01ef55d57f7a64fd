package com.example.vibescore.application;

import com.example.vibescore.domain.Answer;
import com.example.vibescore.domain.RecallBand;
import com.example.vibescore.domain.ScoreBreakdown;
import com.example.vibescore.domain.TrackScore;
import com.example.vibescore.domain.VibeRating;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Remember/Know weighted scoring. A higher score means weaker recognition of one's own work.
 */
@Component
public class ScoringEngine {
    static final double FORGET_WEIGHT = 50;
    static final double FUZZY_WEIGHT = 30;
    static final double FALSE_MEMORY_WEIGHT = 20;
    static final double CODE_WEIGHT = 0.5;
    static final double COMMENT_WEIGHT = 0.35;
    static final int BONUS_PER_DAY = 3;
    static final int MAX_VELOCITY_BONUS = 15;
    static final int MAX_SCORE = 100;

    public TrackScore scoreTrack(List<Answer> answers) {
        int selfCount = 0;
        int otherCount = 0;
        int remembered = 0;
        int familiar = 0;
        int uncertain = 0;
        int foreign = 0;
        int rejected = 0;
        int falseMemory = 0;

        for (Answer answer : answers) {
            if (answer.selfAuthored()) {
                selfCount++;
                switch (answer.confidenceLevel()) {
                    case REMEMBER -> remembered++;
                    case FAMILIAR -> familiar++;
                    case UNCERTAIN -> uncertain++;
                    case FOREIGN -> foreign++;
                    default -> throw new IllegalStateException("Unexpected level " + answer.confidenceLevel());
                }
            } else {
                otherCount++;
                if (answer.confidenceLevel().claimsOwnership()) {
                    falseMemory++;
                } else {
                    rejected++;
                }
            }
        }

        int myTotal = Math.max(1, selfCount);
        int otherTotal = Math.max(1, otherCount);
        double forgetRate = (double) (uncertain + foreign) / myTotal;
        double fuzzyRate = (double) familiar / myTotal;
        double falseMemoryRate = (double) falseMemory / otherTotal;
        int score = (int) Math.min(
                MAX_SCORE,
                Math.round(forgetRate * FORGET_WEIGHT + fuzzyRate * FUZZY_WEIGHT + falseMemoryRate * FALSE_MEMORY_WEIGHT));

        return new TrackScore(
                selfCount,
                otherCount,
                remembered,
                familiar,
                uncertain,
                foreign,
                rejected,
                falseMemory,
                forgetRate,
                fuzzyRate,
                falseMemoryRate,
                score,
                RecallBand.forScore(score));
    }

    public static int velocityBonus(int highOutputDays) {
        return Math.min(Math.max(0, highOutputDays) * BONUS_PER_DAY, MAX_VELOCITY_BONUS);
    }

    public static int compositeScore(int codeScore, int commentScore, int velocityBonus) {
        return (int) Math.min(
                MAX_SCORE, Math.round(codeScore * CODE_WEIGHT + commentScore * COMMENT_WEIGHT + velocityBonus));
    }

    public ScoreBreakdown score(List<Answer> codeAnswers, List<Answer> commentAnswers, int highOutputDays) {
        TrackScore code = scoreTrack(codeAnswers);
        TrackScore comment = scoreTrack(commentAnswers);
        int bonus = velocityBonus(highOutputDays);
        int total = compositeScore(code.score(), comment.score(), bonus);
        return new ScoreBreakdown(code, comment, highOutputDays, bonus, total, VibeRating.forScore(total));
    }
}
