package com.example.vibescore.web;

import com.example.vibescore.application.QuizSession;
import com.example.vibescore.application.QuizSessionRegistry;
import com.example.vibescore.application.ScanUseCase;
import com.example.vibescore.domain.QuizPhase;
import com.example.vibescore.domain.ScanRequest;
import com.example.vibescore.domain.ScanResult;
import com.example.vibescore.domain.ScoreBreakdown;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
public class QuizController {
    private final ScanUseCase scanUseCase;
    private final QuizSessionRegistry sessionRegistry;

    public QuizController(ScanUseCase scanUseCase, QuizSessionRegistry sessionRegistry) {
        this.scanUseCase = scanUseCase;
        this.sessionRegistry = sessionRegistry;
    }

    @GetMapping("/identities")
    public List<IdentityView> identities() {
        return scanUseCase.listIdentities().stream().map(IdentityView::of).toList();
    }

    @PostMapping("/scans")
    @ResponseStatus(HttpStatus.CREATED)
    public SessionSummary scan(@RequestBody ScanRequestBody body) {
        if (body == null || body.identities() == null || body.identities().isEmpty()) {
            throw new InvalidRequestException("At least one identity must be selected");
        }
        if (body.identities().stream().anyMatch(key -> key == null || key.isBlank())) {
            throw new InvalidRequestException("Identity keys must not be blank");
        }
        ScanResult result = scanUseCase.scan(new ScanRequest(new LinkedHashSet<>(body.identities())));
        QuizSession session = sessionRegistry.create(result);
        return SessionSummary.of(session);
    }

    @GetMapping("/sessions/{id}")
    public SessionView session(@PathVariable("id") UUID id) {
        return SessionView.of(sessionRegistry.get(id));
    }

    @PostMapping("/sessions/{id}/answers")
    public SessionView answer(@PathVariable("id") UUID id, @RequestBody AnswerRequest request) {
        if (request == null || request.track() == null || request.confidence() == null) {
            throw new InvalidRequestException("track and confidence are required");
        }
        QuizSession session = sessionRegistry.get(id);
        QuizPhase phase = session.answer(request.track(), request.questionIndex(), request.confidence());
        return SessionView.of(session, phase);
    }

    @GetMapping("/sessions/{id}/score")
    public ScoreBreakdown score(@PathVariable("id") UUID id) {
        return sessionRegistry.get(id).score();
    }

    @DeleteMapping("/sessions/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void discard(@PathVariable("id") UUID id) {
        sessionRegistry.remove(id);
    }
}
