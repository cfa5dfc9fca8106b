package com.herzen.mastery.reasoning;

import com.herzen.mastery.graph.KnowledgeGraphModels.RelationshipTypes;
import com.herzen.mastery.reasoning.ReasoningModels.InferenceRule;
import com.herzen.mastery.reasoning.ReasoningModels.RuleKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class InferenceRuleRegistry {
    private static final Logger log = LoggerFactory.getLogger(InferenceRuleRegistry.class);

    private final Map<String, InferenceRule> rules = Collections.synchronizedMap(new LinkedHashMap<>());

    public InferenceRuleRegistry() {
        registerDefaults();
    }

    public void registerRule(InferenceRule rule) {
        rules.put(rule.ruleId(), rule);
        log.info("Registered inference rule {} ({} on '{}', maxHops={}, weight={})",
                rule.ruleId(), rule.kind(), rule.sourcePredicate(), rule.maxHops(), rule.confidenceWeight());
    }

    public Optional<InferenceRule> getRule(String ruleId) {
        return ruleId == null ? Optional.empty() : Optional.ofNullable(rules.get(ruleId));
    }

    /** Rules ordered by priority, highest first, then registration order. */
    public List<InferenceRule> listRules(boolean activeOnly) {
        List<InferenceRule> snapshot;
        synchronized (rules) {
            snapshot = new ArrayList<>(rules.values());
        }
        return snapshot.stream()
                .filter(r -> !activeOnly || r.active())
                .sorted(Comparator.comparingInt(InferenceRule::priority).reversed())
                .toList();
    }

    public boolean deactivateRule(String ruleId) {
        InferenceRule updated = rules.computeIfPresent(ruleId, (id, rule) -> rule.withActive(false));
        if (updated == null) return false;
        log.info("Deactivated inference rule {}", ruleId);
        return true;
    }

    private void registerDefaults() {
        registerRule(new InferenceRule("rule-prerequisite-transitive", "Transitive prerequisites",
                "If A is a prerequisite of B and B of C, A is an indirect prerequisite of C",
                RuleKind.TRANSITIVE, RelationshipTypes.PREREQUISITE, "indirect_prerequisite",
                5, 0.9, 10, true, Set.of(), null, null));
        registerRule(new InferenceRule("rule-related-symmetric", "Symmetric relatedness",
                "Relatedness holds in both directions",
                RuleKind.SYMMETRIC, RelationshipTypes.RELATED_TO, null,
                1, 0.7, 5, true, Set.of(), null, null));
        registerRule(new InferenceRule("rule-prerequisite-inverse", "Prerequisite enables",
                "If A is a prerequisite of B, B is enabled by A",
                RuleKind.INVERSE, RelationshipTypes.PREREQUISITE, RelationshipTypes.ENABLES,
                1, 0.85, 8, true, Set.of(), null, null));
        registerRule(new InferenceRule("rule-component-transitive", "Transitive composition",
                "A component of a component is a component of the whole",
                RuleKind.TRANSITIVE, RelationshipTypes.COMPONENT_OF, null,
                3, 0.8, 7, true, Set.of(), null, null));
        registerRule(new InferenceRule("rule-similarity-symmetric", "Symmetric similarity",
                "Similarity holds in both directions",
                RuleKind.SYMMETRIC, RelationshipTypes.SIMILAR_TO, null,
                1, 0.6, 3, true, Set.of(), null, null));
    }
}
