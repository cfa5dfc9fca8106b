package com.herzen.mastery.reasoning;

import com.herzen.mastery.config.ReasoningProperties;
import com.herzen.mastery.graph.ConceptGraph;
import com.herzen.mastery.graph.KnowledgeGraphService;
import com.herzen.mastery.reasoning.ReasoningModels.InferenceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class GraphRefreshTask {
    private static final Logger log = LoggerFactory.getLogger(GraphRefreshTask.class);

    private final KnowledgeGraphService knowledgeGraphService;
    private final InferenceEngine inferenceEngine;
    private final ReasoningProperties properties;

    public GraphRefreshTask(KnowledgeGraphService knowledgeGraphService,
                            InferenceEngine inferenceEngine,
                            ReasoningProperties properties) {
        this.knowledgeGraphService = knowledgeGraphService;
        this.inferenceEngine = inferenceEngine;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${reasoning.refresh.fixed-delay-ms:600000}")
    public void scheduledRefresh() {
        if (!properties.getRefresh().isEnabled()) return;
        refreshAll();
    }

    public int refreshAll() {
        int total = 0;
        for (String catalogId : knowledgeGraphService.catalogIds()) {
            Optional<ConceptGraph> graph = knowledgeGraphService.snapshot(catalogId);
            if (graph.isEmpty()) continue;
            InferenceResult result = inferenceEngine.runInference(graph.get());
            total += result.relationships().size();
        }
        log.info("Refreshed inferences for {} catalog(s): {} new relationship(s)", knowledgeGraphService.catalogIds().size(), total);
        return total;
    }
}
