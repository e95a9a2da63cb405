package com.promptflow.promptflow_backend.suggestion;

import com.promptflow.promptflow_backend.model.domain.NodeType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Providers keyed by the source node type they handle. Built once, never modified. */
public class SuggestionRuleSet {

    private final Map<NodeType, SuggestionProvider> providers;

    public SuggestionRuleSet(List<SuggestionProvider> providers) {
        Map<NodeType, SuggestionProvider> registry = new EnumMap<>(NodeType.class);
        for (SuggestionProvider provider : providers) {
            if (registry.putIfAbsent(provider.supportedType(), provider) != null) {
                throw new IllegalArgumentException("Two suggestion providers registered for " + provider.supportedType());
            }
        }
        this.providers = Collections.unmodifiableMap(registry);
    }

    public static SuggestionRuleSet standard() {
        return new SuggestionRuleSet(List.of(
                new PromptSuggestionProvider(),
                new VariableSuggestionProvider(),
                new ConditionalSuggestionProvider(),
                new TransformSuggestionProvider()
        ));
    }

    public Optional<SuggestionProvider> providerFor(NodeType type) {
        return Optional.ofNullable(providers.get(type));
    }

    public boolean isSupported(NodeType type) {
        return providers.containsKey(type);
    }
}
