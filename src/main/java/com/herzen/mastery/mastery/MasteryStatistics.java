package com.herzen.mastery.mastery;

import com.herzen.mastery.mastery.MasteryModels.MasteryStatisticsSnapshot;
import com.herzen.mastery.repository.LearningSessionRepository;
import com.herzen.mastery.repository.MasteryRepository;
import org.springframework.stereotype.Component;

@Component
public class MasteryStatistics {
    private final MasteryRepository masteryRepository;
    private final LearningSessionRepository sessionRepository;

    private long totalMasteryUpdates;
    private long weakConceptsDetected;
    private int reviewsScheduled;

    public MasteryStatistics(MasteryRepository masteryRepository, LearningSessionRepository sessionRepository) {
        this.masteryRepository = masteryRepository;
        this.sessionRepository = sessionRepository;
    }

    public synchronized void recordUpdate() {
        totalMasteryUpdates++;
    }

    public synchronized void recordWeakConcepts(int count) {
        weakConceptsDetected += count;
    }

    // size of the most recent schedule, not a running total
    public synchronized void recordSchedule(int size) {
        reviewsScheduled = size;
    }

    public synchronized MasteryStatisticsSnapshot snapshot() {
        return new MasteryStatisticsSnapshot(totalMasteryUpdates, masteryRepository.count(), weakConceptsDetected,
                reviewsScheduled, masteryRepository.learnerIds().size(), sessionRepository.countActive());
    }
}
