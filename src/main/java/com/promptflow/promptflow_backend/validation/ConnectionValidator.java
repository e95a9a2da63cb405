package com.promptflow.promptflow_backend.validation;

import com.promptflow.promptflow_backend.graph.GraphReachability;
import com.promptflow.promptflow_backend.model.domain.FlowEdge;
import com.promptflow.promptflow_backend.model.domain.FlowNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;

/**
 * Decides whether a candidate edge may be added. Checks run in a fixed order and stop at
 * the first failure: self-loop, cycle, compatibility table, then advisory rules.
 * Never throws for an invalid connection; the result says why.
 */
@Slf4j
public class ConnectionValidator {

    public static final String SELF_LOOP_MESSAGE = "self-loop not permitted.";
    public static final String CYCLE_MESSAGE = "This connection would create a circular dependency";

    private final ConnectionRuleSet rules;

    public ConnectionValidator(ConnectionRuleSet rules) {
        this.rules = rules != null ? rules : ConnectionRuleSet.empty();
    }

    public ConnectionResult validate(ConnectionCandidate candidate, Collection<FlowEdge> existingEdges) {
        FlowNode source = candidate.source();
        FlowNode target = candidate.target();

        if (source.getId().equals(target.getId())) {
            return ConnectionResult.invalid(SELF_LOOP_MESSAGE);
        }

        // The new edge closes a cycle iff the source is already reachable from the target
        if (GraphReachability.canReach(existingEdges, target.getId(), source.getId())) {
            log.debug("Rejected {} -> {}: {} already reaches {}", source.getId(), target.getId(), target.getId(), source.getId());
            return ConnectionResult.invalid(CYCLE_MESSAGE);
        }

        for (CompatibilityRule rule : rules.compatibilityRules()) {
            ConnectionResult result = rule.check(candidate);
            if (!result.valid()) {
                log.debug("Rejected {} -> {} by compatibility rule '{}'", source.getId(), target.getId(), rule.name());
                return result;
            }
        }

        return rules.connectionRules().stream()
                .filter(rule -> rule.matches(source, target))
                .findFirst()
                .map(rule -> ConnectionResult.okWithSuggestion(rule.suggestion()))
                .orElse(ConnectionResult.ok());
    }

    public ConnectionRuleSet getRules() {
        return rules;
    }
}
