package com.example.vibescore.application;

import com.example.vibescore.domain.CodeFragment;
import com.example.vibescore.domain.CommentFragment;
import com.example.vibescore.domain.FinishedBlock;
import com.example.vibescore.domain.FragmentOrigin;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Turns finished blocks into quiz fragments: one random contiguous window per code block, the
 * whole text for a comment block.
 */
@Component
public class SnippetWindower {
    static final double WINDOW_RATIO = 0.7;

    private final Random random;

    public SnippetWindower(Random random) {
        this.random = random;
    }

    public static int windowLength(int blockLength) {
        int target = (int) Math.floor(blockLength * WINDOW_RATIO);
        int upper = Math.min(CodeFragment.MAX_LINES, blockLength);
        return Math.min(upper, Math.max(CodeFragment.MIN_LINES, target));
    }

    public List<String> window(List<String> block) {
        if (block.size() < CodeFragment.MIN_LINES) {
            throw new IllegalArgumentException(
                    "Code block needs at least " + CodeFragment.MIN_LINES + " lines but had " + block.size());
        }
        int length = windowLength(block.size());
        int start = random.nextInt(block.size() - length + 1);
        return List.copyOf(block.subList(start, start + length));
    }

    public CodeFragment toCodeFragment(FinishedBlock block, FragmentOrigin origin) {
        List<String> lines = window(block.lines());
        return new CodeFragment(
                origin.filePath(),
                lines,
                origin.authorIdentity(),
                origin.changeId(),
                origin.selfAuthored(),
                Fingerprints.of(lines));
    }

    public Optional<CommentFragment> toCommentFragment(FinishedBlock block, FragmentOrigin origin) {
        if (block.lines().isEmpty() || !CommentFragment.hasProse(block.lines())) {
            return Optional.empty();
        }
        return Optional.of(
                new CommentFragment(
                        origin.filePath(),
                        block.lines(),
                        block.context(),
                        origin.authorIdentity(),
                        origin.selfAuthored(),
                        Fingerprints.of(block.lines())));
    }
}
