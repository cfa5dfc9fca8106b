package com.herzen.mastery.repository;

import com.herzen.mastery.mastery.MasteryModels.LearningSession;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Repository
public class LearningSessionRepository {
    private final Map<String, LearningSession> sessions = new ConcurrentHashMap<>();

    public void save(LearningSession session) {
        sessions.put(session.sessionId(), session);
    }

    public Optional<LearningSession> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    /** Atomically replaces a stored session; returns null when the id is unknown. */
    public LearningSession update(String sessionId, UnaryOperator<LearningSession> change) {
        if (sessionId == null) return null;
        return sessions.computeIfPresent(sessionId, (id, session) -> change.apply(session));
    }

    public List<LearningSession> findByLearner(String learnerId) {
        return sessions.values().stream()
                .filter(s -> s.learnerId().equals(learnerId))
                .sorted(Comparator.comparing(LearningSession::startedAt))
                .toList();
    }

    public int countActive() {
        return (int) sessions.values().stream().filter(LearningSession::active).count();
    }
}
