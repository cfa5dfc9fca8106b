package com.herzen.mastery.mastery;

import com.herzen.mastery.mastery.MasteryModels.InteractionRecord;
import com.herzen.mastery.mastery.MasteryModels.InteractionResult;
import com.herzen.mastery.mastery.MasteryModels.LearningSession;
import com.herzen.mastery.mastery.MasteryModels.SessionInteraction;
import com.herzen.mastery.repository.LearningSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

@Service
public class LearningSessionService {
    private static final Logger log = LoggerFactory.getLogger(LearningSessionService.class);
    private static final int DEFAULT_VELOCITY_DAYS = 7;

    private final LearningSessionRepository repository;
    private final MasteryTracker tracker;
    private final Clock clock;

    public LearningSessionService(LearningSessionRepository repository, MasteryTracker tracker, Clock clock) {
        this.repository = repository;
        this.tracker = tracker;
        this.clock = clock;
    }

    public LearningSession startSession(String learnerId) {
        return startSession(learnerId, clock.instant());
    }

    public LearningSession startSession(String learnerId, Instant now) {
        Objects.requireNonNull(learnerId, "learnerId");
        LearningSession session = new LearningSession(UUID.randomUUID().toString(), learnerId, now, null, List.of());
        repository.save(session);
        log.info("Started learning session {} for learner {}", session.sessionId(), learnerId);
        return session;
    }

    public ConceptMastery recordSessionInteraction(String sessionId, InteractionResult result) {
        return recordSessionInteraction(sessionId, result, clock.instant());
    }

    public ConceptMastery recordSessionInteraction(String sessionId, InteractionResult result, Instant now) {
        Objects.requireNonNull(result, "result");
        SessionInteraction interaction = new SessionInteraction(result.conceptId(), result.interactionType(),
                result.success(), result.score(), result.timeSpentSeconds(), now);
        LearningSession session = updateActive(sessionId, s -> s.withInteraction(interaction));

        InteractionResult stamped = new InteractionResult(result.conceptId(), result.interactionType(), result.success(),
                result.score(), result.timeSpentSeconds(), result.difficultyRating(), result.attemptNumber(), sessionId);
        return tracker.updateMastery(session.learnerId(), stamped, now);
    }

    public LearningSession endSession(String sessionId) {
        return endSession(sessionId, clock.instant());
    }

    public LearningSession endSession(String sessionId, Instant now) {
        LearningSession ended = updateActive(sessionId, s -> s.end(now));
        log.info("Ended learning session {}: {} interaction(s), {} concept(s), accuracy {}",
                sessionId, ended.interactions().size(), ended.conceptsCovered().size(), ended.accuracyRate());
        return ended;
    }

    public Optional<LearningSession> getSession(String sessionId) {
        return repository.find(sessionId);
    }

    public List<LearningSession> getSessions(String learnerId) {
        return repository.findByLearner(learnerId);
    }

    public double getLearningVelocity(String learnerId) {
        return getLearningVelocity(learnerId, DEFAULT_VELOCITY_DAYS, clock.instant());
    }

    public double getLearningVelocity(String learnerId, int days) {
        return getLearningVelocity(learnerId, days, clock.instant());
    }

    /**
     * Mastery gained per hour of session time over the last {@code days}: the sum of positive score
     * changes in that window divided by the hours of sessions started in it. Zero without session time.
     */
    public double getLearningVelocity(String learnerId, int days, Instant now) {
        if (days <= 0) return 0.0;
        Instant windowStart = now.minus(Duration.ofDays(days));

        long minutes = 0;
        for (LearningSession session : repository.findByLearner(learnerId)) {
            if (session.startedAt().isBefore(windowStart) || session.startedAt().isAfter(now)) continue;
            minutes += session.durationMinutes(now);
        }
        if (minutes == 0) return 0.0;

        double gained = 0.0;
        for (ConceptMastery mastery : tracker.getAllMastery(learnerId)) {
            List<InteractionRecord> history;
            synchronized (mastery) {
                history = mastery.getHistory();
            }
            for (InteractionRecord record : history) {
                if (record.timestamp().isBefore(windowStart) || record.timestamp().isAfter(now)) continue;
                gained += Math.max(0.0, record.scoreAfter() - record.scoreBefore());
            }
        }
        return gained / (minutes / 60.0);
    }

    private LearningSession updateActive(String sessionId, UnaryOperator<LearningSession> change) {
        LearningSession session = repository.update(sessionId, current -> {
            if (!current.active()) {
                throw new IllegalStateException("Learning session already ended: " + sessionId);
            }
            return change.apply(current);
        });
        if (session == null) {
            throw new IllegalArgumentException("Unknown learning session: " + sessionId);
        }
        return session;
    }
}
