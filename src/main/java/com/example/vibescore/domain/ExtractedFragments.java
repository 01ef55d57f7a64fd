package com.example.vibescore.domain;

import java.util.List;

public record ExtractedFragments(List<CodeFragment> codeFragments, List<CommentFragment> commentFragments) {
    public ExtractedFragments {
        codeFragments = List.copyOf(codeFragments);
        commentFragments = List.copyOf(commentFragments);
    }
}
