package com.example.vibescore.domain;

import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * Holds the pools, velocity statistics and sampled questions of one scan.
 */
@Getter
public class ScanResult {
    private final List<CodeFragment> codeFragments;
    private final List<CommentFragment> commentFragments;
    private final List<DailyStat> velocity;
    private final List<CodeFragment> codeQuestions;
    private final List<CommentFragment> commentQuestions;
    private final int changesScanned;
    private final int changesSkipped;
    @Setter
    private ScanTiming timing;

    public ScanResult(
            List<CodeFragment> codeFragments,
            List<CommentFragment> commentFragments,
            List<DailyStat> velocity,
            List<CodeFragment> codeQuestions,
            List<CommentFragment> commentQuestions,
            int changesScanned,
            int changesSkipped) {
        this.codeFragments = List.copyOf(codeFragments);
        this.commentFragments = List.copyOf(commentFragments);
        this.velocity = List.copyOf(velocity);
        this.codeQuestions = List.copyOf(codeQuestions);
        this.commentQuestions = List.copyOf(commentQuestions);
        this.changesScanned = changesScanned;
        this.changesSkipped = changesSkipped;
        this.timing = null;
    }
}
