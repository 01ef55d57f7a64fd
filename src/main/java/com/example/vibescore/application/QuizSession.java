package com.example.vibescore.application;

import com.example.vibescore.domain.Answer;
import com.example.vibescore.domain.CodeFragment;
import com.example.vibescore.domain.CommentFragment;
import com.example.vibescore.domain.ConfidenceLevel;
import com.example.vibescore.domain.QuizPhase;
import com.example.vibescore.domain.QuizTrack;
import com.example.vibescore.domain.ScanResult;
import com.example.vibescore.domain.ScoreBreakdown;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One run through the code questions and then the comment questions of a scan. Answers are
 * append-only and must be given in question order.
 */
public class QuizSession {
    private final UUID id;
    private final Instant created;
    private final ScanResult scan;
    private final ScoringEngine scoringEngine;
    private final List<Answer> codeAnswers = new ArrayList<>();
    private final List<Answer> commentAnswers = new ArrayList<>();
    private QuizPhase phase;

    public QuizSession(UUID id, Instant created, ScanResult scan, ScoringEngine scoringEngine) {
        this.id = Objects.requireNonNull(id, "id");
        this.created = Objects.requireNonNull(created, "created");
        this.scan = Objects.requireNonNull(scan, "scan");
        this.scoringEngine = Objects.requireNonNull(scoringEngine, "scoringEngine");
        this.phase = scan.getCodeQuestions().isEmpty() ? nextAfterCode() : QuizPhase.CODE;
    }

    public UUID getId() {
        return id;
    }

    public Instant getCreated() {
        return created;
    }

    public ScanResult getScan() {
        return scan;
    }

    public synchronized QuizPhase getPhase() {
        return phase;
    }

    public synchronized List<Answer> answers(QuizTrack track) {
        return List.copyOf(track == QuizTrack.CODE ? codeAnswers : commentAnswers);
    }

    public synchronized QuizPhase answer(QuizTrack track, int questionIndex, ConfidenceLevel confidence) {
        Objects.requireNonNull(track, "track");
        Objects.requireNonNull(confidence, "confidence");
        if (phase == QuizPhase.FINISHED) {
            throw new QuizStateException("Quiz is already finished");
        }
        QuizTrack current = phase == QuizPhase.CODE ? QuizTrack.CODE : QuizTrack.COMMENT;
        if (track != current) {
            throw new QuizStateException("Expected an answer for the " + current.label() + " track");
        }
        List<Answer> log = track == QuizTrack.CODE ? codeAnswers : commentAnswers;
        if (questionIndex != log.size()) {
            throw new QuizStateException(
                    "Expected an answer for question " + log.size() + " but got " + questionIndex);
        }
        log.add(new Answer(confidence, isSelfAuthored(track, questionIndex)));
        if (log.size() == questionCount(track)) {
            phase = track == QuizTrack.CODE ? nextAfterCode() : QuizPhase.FINISHED;
        }
        return phase;
    }

    public synchronized ScoreBreakdown score() {
        if (phase != QuizPhase.FINISHED) {
            throw new QuizStateException("Quiz is not finished yet");
        }
        return scoringEngine.score(codeAnswers, commentAnswers, scan.getVelocity().size());
    }

    public int questionCount(QuizTrack track) {
        return track == QuizTrack.CODE ? scan.getCodeQuestions().size() : scan.getCommentQuestions().size();
    }

    private boolean isSelfAuthored(QuizTrack track, int questionIndex) {
        if (track == QuizTrack.CODE) {
            CodeFragment fragment = scan.getCodeQuestions().get(questionIndex);
            return fragment.selfAuthored();
        }
        CommentFragment fragment = scan.getCommentQuestions().get(questionIndex);
        return fragment.selfAuthored();
    }

    private QuizPhase nextAfterCode() {
        return scan.getCommentQuestions().isEmpty() ? QuizPhase.FINISHED : QuizPhase.COMMENT;
    }
}
