package com.example.vibescore.application;

import com.example.vibescore.domain.ChangeRecord;
import com.example.vibescore.domain.CodeFragment;
import com.example.vibescore.domain.CommentFragment;
import com.example.vibescore.domain.DiffLine;
import com.example.vibescore.domain.ExtractedFragments;
import com.example.vibescore.domain.FileSegment;
import com.example.vibescore.domain.FinishedBlock;
import com.example.vibescore.domain.FragmentOrigin;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs segmentation, classification, block accumulation and windowing over the diff of a single
 * change.
 */
@Service
public class FragmentExtractor {
    private final DiffSegmenter segmenter;
    private final LineClassifier classifier;
    private final SnippetWindower windower;

    public FragmentExtractor(DiffSegmenter segmenter, LineClassifier classifier, SnippetWindower windower) {
        this.segmenter = segmenter;
        this.classifier = classifier;
        this.windower = windower;
    }

    public ExtractedFragments extract(ChangeRecord change, String diff, boolean selfAuthored) {
        List<CodeFragment> code = new ArrayList<>();
        List<CommentFragment> comments = new ArrayList<>();
        for (FileSegment segment : segmenter.segment(diff)) {
            FragmentOrigin origin =
                    new FragmentOrigin(segment.path(), change.identityKey(), change.shortId(), selfAuthored);
            List<FinishedBlock> blocks = new ArrayList<>();
            BlockAccumulator accumulator = new BlockAccumulator(classifier);
            for (DiffLine line : segment.lines()) {
                blocks.addAll(accumulator.observe(line));
            }
            blocks.addAll(accumulator.finish());

            for (FinishedBlock block : blocks) {
                if (block.kind() == FinishedBlock.Kind.CODE) {
                    code.add(windower.toCodeFragment(block, origin));
                } else {
                    windower.toCommentFragment(block, origin).ifPresent(comments::add);
                }
            }
        }
        return new ExtractedFragments(code, comments);
    }
}
