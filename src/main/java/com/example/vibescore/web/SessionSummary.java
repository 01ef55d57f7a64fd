package com.example.vibescore.web;

import com.example.vibescore.application.QuizSession;
import com.example.vibescore.domain.DailyStat;
import com.example.vibescore.domain.ScanResult;
import com.example.vibescore.domain.ScanTiming;

import java.util.List;
import java.util.UUID;

/**
 * What a freshly started session reports back: sizes, velocity and timings.
 */
public record SessionSummary(
        UUID sessionId,
        int codeQuestions,
        int commentQuestions,
        int codeFragments,
        int commentFragments,
        int changesScanned,
        int changesSkipped,
        List<DailyStat> velocity,
        ScanTiming timing) {

    public static SessionSummary of(QuizSession session) {
        ScanResult scan = session.getScan();
        return new SessionSummary(
                session.getId(),
                scan.getCodeQuestions().size(),
                scan.getCommentQuestions().size(),
                scan.getCodeFragments().size(),
                scan.getCommentFragments().size(),
                scan.getChangesScanned(),
                scan.getChangesSkipped(),
                scan.getVelocity(),
                scan.getTiming());
    }
}
