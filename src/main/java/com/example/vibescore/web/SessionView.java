package com.example.vibescore.web;

import com.example.vibescore.application.QuizSession;
import com.example.vibescore.domain.CodeFragment;
import com.example.vibescore.domain.CommentFragment;
import com.example.vibescore.domain.QuizPhase;
import com.example.vibescore.domain.QuizTrack;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * The session as shown to the player: current phase, progress and the questions of the current
 * track. Ownership of the fragments is never exposed.
 */
public record SessionView(UUID sessionId, QuizPhase phase, int answered, int total, List<QuestionView> questions) {

    public static SessionView of(QuizSession session) {
        return of(session, session.getPhase());
    }

    static SessionView of(QuizSession session, QuizPhase phase) {
        if (phase == QuizPhase.FINISHED) {
            return new SessionView(session.getId(), phase, 0, 0, List.of());
        }
        QuizTrack track = phase == QuizPhase.CODE ? QuizTrack.CODE : QuizTrack.COMMENT;
        List<QuestionView> questions = new ArrayList<>();
        if (track == QuizTrack.CODE) {
            List<CodeFragment> code = session.getScan().getCodeQuestions();
            for (int i = 0; i < code.size(); i++) {
                questions.add(new QuestionView(i, code.get(i).filePath(), code.get(i).lines(), List.of()));
            }
        } else {
            List<CommentFragment> comments = session.getScan().getCommentQuestions();
            for (int i = 0; i < comments.size(); i++) {
                CommentFragment fragment = comments.get(i);
                questions.add(
                        new QuestionView(i, fragment.filePath(), fragment.commentLines(), fragment.contextLines()));
            }
        }
        return new SessionView(
                session.getId(), phase, session.answers(track).size(), session.questionCount(track), questions);
    }

    public record QuestionView(int index, String filePath, List<String> lines, List<String> context) {}
}
