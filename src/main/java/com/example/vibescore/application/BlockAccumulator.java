package com.example.vibescore.application;

import com.example.vibescore.domain.CodeFragment;
import com.example.vibescore.domain.DiffLine;
import com.example.vibescore.domain.FinishedBlock;
import com.example.vibescore.domain.LineCategory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Groups the lines of one file section into code blocks and comment blocks.
 *
 * <p>Feed every line of the section to {@link #observe(DiffLine)} in order, then call
 * {@link #finish()} once. Code runs shorter than {@link CodeFragment#MIN_LINES} are dropped at the
 * boundary that closes them. Not thread-safe; use one instance per file section.
 */
public class BlockAccumulator {
    static final int CONTEXT_WINDOW = 5;
    static final int COMMENT_CONTEXT = 2;

    private final LineClassifier classifier;
    private final List<String> codeBuffer = new ArrayList<>();
    private final List<String> commentBuffer = new ArrayList<>();
    private final Deque<String> contextWindow = new ArrayDeque<>(CONTEXT_WINDOW);
    private boolean finished;

    public BlockAccumulator(LineClassifier classifier) {
        this.classifier = classifier;
    }

    public List<FinishedBlock> observe(DiffLine line) {
        if (finished) {
            throw new IllegalStateException("Accumulator already finished");
        }
        List<FinishedBlock> closed = new ArrayList<>(2);
        switch (line.kind()) {
            case HUNK_HEADER, CONTEXT, REMOVED -> closeCodeBlock(closed);
            case ADDED -> observeAdded(line.text(), closed);
            default -> throw new IllegalStateException("Unexpected line kind " + line.kind());
        }
        return closed;
    }

    public List<FinishedBlock> finish() {
        if (finished) {
            return List.of();
        }
        finished = true;
        List<FinishedBlock> closed = new ArrayList<>(2);
        closeCodeBlock(closed);
        closeCommentBlock(closed);
        return closed;
    }

    private void observeAdded(String text, List<FinishedBlock> closed) {
        LineCategory category = classifier.classify(text);
        switch (category) {
            case BOILERPLATE -> {
                // neither kept nor a boundary
            }
            case COMMENT -> commentBuffer.add(text);
            case SUBSTANTIVE -> {
                closeCommentBlock(closed);
                codeBuffer.add(text);
                if (contextWindow.size() == CONTEXT_WINDOW) {
                    contextWindow.removeFirst();
                }
                contextWindow.addLast(text);
            }
            case NOISE -> {
                closeCommentBlock(closed);
                closeCodeBlock(closed);
            }
            default -> throw new IllegalStateException("Unexpected category " + category);
        }
    }

    private void closeCodeBlock(List<FinishedBlock> closed) {
        if (codeBuffer.size() >= CodeFragment.MIN_LINES) {
            closed.add(FinishedBlock.code(codeBuffer));
        }
        codeBuffer.clear();
    }

    private void closeCommentBlock(List<FinishedBlock> closed) {
        if (commentBuffer.isEmpty()) {
            return;
        }
        closed.add(FinishedBlock.comment(commentBuffer, recentContext()));
        commentBuffer.clear();
    }

    private List<String> recentContext() {
        List<String> window = new ArrayList<>(contextWindow);
        return window.subList(Math.max(0, window.size() - COMMENT_CONTEXT), window.size());
    }
}
