package com.example.vibescore.application;

import com.example.vibescore.domain.ScanResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps active quiz sessions in memory; the oldest session is evicted once the limit is reached.
 */
@Component
public class QuizSessionRegistry {
    private static final Logger log = LogManager.getLogger(QuizSessionRegistry.class);

    private final Map<UUID, QuizSession> sessions = new ConcurrentHashMap<>();
    private final ScoringEngine scoringEngine;
    private final Clock clock;
    private final int maxActiveSessions;

    public QuizSessionRegistry(
            ScoringEngine scoringEngine,
            Clock clock,
            @Value("${vibescore.sessions.max-active:100}") int maxActiveSessions) {
        this.scoringEngine = scoringEngine;
        this.clock = clock;
        this.maxActiveSessions = Math.max(1, maxActiveSessions);
    }

    public synchronized QuizSession create(ScanResult scan) {
        while (sessions.size() >= maxActiveSessions) {
            sessions.values().stream()
                    .min(Comparator.comparing(QuizSession::getCreated))
                    .ifPresent(
                            oldest -> {
                                sessions.remove(oldest.getId());
                                log.info("Evicted quiz session {}", oldest.getId());
                            });
        }
        QuizSession session = new QuizSession(UUID.randomUUID(), clock.instant(), scan, scoringEngine);
        sessions.put(session.getId(), session);
        return session;
    }

    public QuizSession get(UUID id) {
        QuizSession session = sessions.get(id);
        if (session == null) {
            throw new SessionNotFoundException(id);
        }
        return session;
    }

    public void remove(UUID id) {
        if (sessions.remove(id) == null) {
            throw new SessionNotFoundException(id);
        }
    }

    public int size() {
        return sessions.size();
    }
}
