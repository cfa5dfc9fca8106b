package com.herzen.mastery;

import com.herzen.mastery.mastery.ConceptMastery;
import com.herzen.mastery.mastery.LearningSessionService;
import com.herzen.mastery.mastery.MasteryInsightService;
import com.herzen.mastery.mastery.MasteryModels.InteractionRecord;
import com.herzen.mastery.mastery.MasteryModels.InteractionResult;
import com.herzen.mastery.mastery.MasteryModels.InteractionType;
import com.herzen.mastery.mastery.MasteryModels.LearningSession;
import com.herzen.mastery.mastery.MasteryModels.MasteryStatisticsSnapshot;
import com.herzen.mastery.mastery.MasteryStatistics;
import com.herzen.mastery.mastery.MasteryTracker;
import com.herzen.mastery.mastery.ReviewScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.herzen.mastery.TestFixtures.NOW;
import static com.herzen.mastery.TestFixtures.state;
import static com.herzen.mastery.TestFixtures.unique;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class LearningSessionServiceTest {
    @Autowired
    private LearningSessionService sessionService;

    @Autowired
    private MasteryTracker tracker;

    @Autowired
    private MasteryInsightService insightService;

    @Autowired
    private ReviewScheduler reviewScheduler;

    @Autowired
    private MasteryStatistics statistics;

    @Test
    void sessionCollectsInteractionsAndUpdatesMastery() {
        String learner = unique("learner");
        Instant start = NOW.minus(Duration.ofMinutes(45));
        LearningSession session = sessionService.startSession(learner, start);
        assertTrue(session.active());

        ConceptMastery fractions = sessionService.recordSessionInteraction(session.sessionId(),
                InteractionResult.of("fractions", InteractionType.PRACTICE, true, 0.9, 120, 1.0), start.plusSeconds(60));
        sessionService.recordSessionInteraction(session.sessionId(),
                InteractionResult.of("decimals", InteractionType.REVIEW, false, 0.2, 90, 1.0), start.plusSeconds(300));
        sessionService.recordSessionInteraction(session.sessionId(),
                InteractionResult.of("fractions", InteractionType.ASSESSMENT, true, 1.0, 60, 1.0), start.plusSeconds(600));

        assertEquals(2, fractions.getInteractionCount());
        assertSame(fractions, tracker.getConceptMastery(learner, "fractions").orElseThrow());
        assertTrue(tracker.getConceptMastery(learner, "decimals").isPresent());

        LearningSession ended = sessionService.endSession(session.sessionId(), NOW);
        assertFalse(ended.active());
        assertEquals(NOW, ended.endedAt());
        assertEquals(3, ended.interactions().size());
        assertEquals(List.of("fractions", "decimals"), List.copyOf(ended.conceptsCovered()));
        assertEquals(Set.of("decimals"), ended.conceptsReviewed());
        assertEquals(Set.of("fractions"), ended.conceptsLearned());
        assertEquals(2.0 / 3.0, ended.accuracyRate(), 1e-9);
        assertEquals(45, ended.durationMinutes(NOW));
        assertEquals(ended, sessionService.getSession(session.sessionId()).orElseThrow());
        assertEquals(List.of(ended), sessionService.getSessions(learner));
    }

    @Test
    void unknownOrEndedSessionsAreRejected() {
        InteractionResult result = InteractionResult.of("fractions", InteractionType.PRACTICE, true, 0.9, 30, 1.0);
        assertThrows(IllegalArgumentException.class, () -> sessionService.recordSessionInteraction("missing", result, NOW));
        assertThrows(IllegalArgumentException.class, () -> sessionService.endSession("missing", NOW));
        assertTrue(sessionService.getSession("missing").isEmpty());

        String learner = unique("learner");
        LearningSession session = sessionService.startSession(learner, NOW);
        sessionService.endSession(session.sessionId(), NOW.plusSeconds(30));

        assertThrows(IllegalStateException.class, () -> sessionService.recordSessionInteraction(session.sessionId(), result, NOW));
        assertThrows(IllegalStateException.class, () -> sessionService.endSession(session.sessionId(), NOW));
        assertTrue(tracker.getAllMastery(learner).isEmpty());
        assertEquals(1, sessionService.getSession(session.sessionId()).orElseThrow().durationMinutes(NOW));
    }

    @Test
    void velocityIsMasteryGainedPerSessionHour() {
        String learner = unique("learner");
        Instant start = NOW.minus(Duration.ofHours(2));
        LearningSession session = sessionService.startSession(learner, start);
        sessionService.recordSessionInteraction(session.sessionId(),
                InteractionResult.of("fractions", InteractionType.PRACTICE, true, 0.9, 120, 1.0), start.plusSeconds(600));
        sessionService.recordSessionInteraction(session.sessionId(),
                InteractionResult.of("decimals", InteractionType.PRACTICE, true, 0.9, 120, 1.0), start.plusSeconds(1200));
        sessionService.recordSessionInteraction(session.sessionId(),
                InteractionResult.of("ratios", InteractionType.PRACTICE, false, 0.1, 120, 1.0), start.plusSeconds(1800));
        sessionService.endSession(session.sessionId(), start.plus(Duration.ofMinutes(30)));

        double gained = 0.0;
        for (ConceptMastery mastery : tracker.getAllMastery(learner)) {
            for (InteractionRecord record : mastery.getHistory()) {
                gained += Math.max(0.0, record.scoreAfter() - record.scoreBefore());
            }
        }
        assertEquals(0.108, gained, 1e-9);
        assertEquals(gained / 0.5, sessionService.getLearningVelocity(learner, 7, NOW), 1e-9);

        // the window no longer reaches back to the session
        assertEquals(0.0, sessionService.getLearningVelocity(learner, 7, NOW.plus(Duration.ofDays(8))), 1e-9);
        assertEquals(0.0, sessionService.getLearningVelocity(unique("learner"), 7, NOW), 1e-9);
        assertEquals(0.0, sessionService.getLearningVelocity(unique("learner")), 1e-9);
        assertEquals(0.0, sessionService.getLearningVelocity(learner, 0, NOW), 1e-9);
    }

    @Test
    void statisticsTrackUpdatesSessionsWeakConceptsAndSchedules() {
        String learner = unique("learner");
        MasteryStatisticsSnapshot before = statistics.snapshot();

        LearningSession session = sessionService.startSession(learner, NOW);
        assertEquals(before.activeSessions() + 1, statistics.snapshot().activeSessions());
        sessionService.recordSessionInteraction(session.sessionId(),
                InteractionResult.of("fractions", InteractionType.PRACTICE, true, 0.9, 60, 1.0), NOW);
        sessionService.recordSessionInteraction(session.sessionId(),
                InteractionResult.of("decimals", InteractionType.PRACTICE, false, 0.1, 60, 1.0), NOW);
        sessionService.endSession(session.sessionId(), NOW.plusSeconds(120));

        MasteryStatisticsSnapshot afterSession = statistics.snapshot();
        assertEquals(before.activeSessions(), afterSession.activeSessions());
        assertTrue(afterSession.totalMasteryUpdates() >= before.totalMasteryUpdates() + 2);
        assertTrue(afterSession.conceptsTracked() >= before.conceptsTracked() + 2);
        assertTrue(afterSession.activeLearners() >= before.activeLearners() + 1);

        String weakLearner = unique("learner");
        tracker.importRecords(List.of(
                state(weakLearner, "stuck", 0.1, 2.0, 5, 1, 3),
                state(weakLearner, "overdue-a", 0.6, 20.0, 3, 3, -3),
                state(weakLearner, "overdue-b", 0.6, 20.0, 3, 3, -3)));
        assertEquals(1, insightService.detectWeakConcepts(weakLearner, 0.4, 7, NOW).size());
        assertTrue(statistics.snapshot().weakConceptsDetected() >= afterSession.weakConceptsDetected() + 1);

        assertEquals(2, reviewScheduler.getReviewSchedule(weakLearner, Map.of(), 10, NOW).size());
        assertEquals(2, statistics.snapshot().reviewsScheduled());
        reviewScheduler.getReviewSchedule(weakLearner, Map.of(), 1, NOW);
        assertEquals(1, statistics.snapshot().reviewsScheduled());
    }
}
