package com.promptflow.promptflow_backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.promptflow.promptflow_backend.engine.IterationRunner;
import com.promptflow.promptflow_backend.graph.NodeIdGenerator;
import com.promptflow.promptflow_backend.graph.SequentialNodeIdGenerator;
import com.promptflow.promptflow_backend.graph.UuidNodeIdGenerator;
import com.promptflow.promptflow_backend.suggestion.ConditionalSuggestionProvider;
import com.promptflow.promptflow_backend.suggestion.PromptSuggestionProvider;
import com.promptflow.promptflow_backend.suggestion.SuggestionEngine;
import com.promptflow.promptflow_backend.suggestion.SuggestionProvider;
import com.promptflow.promptflow_backend.suggestion.SuggestionRuleSet;
import com.promptflow.promptflow_backend.suggestion.TransformSuggestionProvider;
import com.promptflow.promptflow_backend.suggestion.VariableSuggestionProvider;
import com.promptflow.promptflow_backend.validation.ConnectionRuleSet;
import com.promptflow.promptflow_backend.validation.ConnectionValidator;
import com.promptflow.promptflow_backend.validation.FlowValidator;
import com.promptflow.promptflow_backend.variable.VariableCoercer;
import com.promptflow.promptflow_backend.variable.VariableResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/** Rule tables, engines and helpers of the graph editor. */
@Slf4j
@Configuration
public class FlowRulesConfig {

    @Bean
    public ConnectionRuleSet connectionRuleSet() {
        return ConnectionRuleSet.standard();
    }

    @Bean
    public ConnectionValidator connectionValidator(ConnectionRuleSet connectionRuleSet) {
        return new ConnectionValidator(connectionRuleSet);
    }

    @Bean
    public PromptSuggestionProvider promptSuggestionProvider() {
        return new PromptSuggestionProvider();
    }

    @Bean
    public VariableSuggestionProvider variableSuggestionProvider() {
        return new VariableSuggestionProvider();
    }

    @Bean
    public ConditionalSuggestionProvider conditionalSuggestionProvider() {
        return new ConditionalSuggestionProvider();
    }

    @Bean
    public TransformSuggestionProvider transformSuggestionProvider() {
        return new TransformSuggestionProvider();
    }

    // Every SuggestionProvider bean is registered by the type it handles
    @Bean
    public SuggestionRuleSet suggestionRuleSet(List<SuggestionProvider> providers) {
        return new SuggestionRuleSet(providers);
    }

    @Bean
    public SuggestionEngine suggestionEngine(SuggestionRuleSet suggestionRuleSet,
                                             @Value("${app.suggestions.limit:5}") int limit) {
        return new SuggestionEngine(suggestionRuleSet, limit);
    }

    @Bean
    public NodeIdGenerator nodeIdGenerator(@Value("${app.ids.strategy:uuid}") String strategy) {
        if ("sequential".equalsIgnoreCase(strategy.trim())) {
            log.info("Using sequential node ids");
            return new SequentialNodeIdGenerator();
        }
        return new UuidNodeIdGenerator();
    }

    @Bean
    public FlowValidator flowValidator() {
        return new FlowValidator();
    }

    @Bean
    public VariableResolver variableResolver(ObjectMapper objectMapper) {
        return new VariableResolver(objectMapper);
    }

    @Bean
    public VariableCoercer variableCoercer(ObjectMapper objectMapper) {
        return new VariableCoercer(objectMapper);
    }

    // Started on first use of the runner, not with the context
    @Lazy
    @Bean(destroyMethod = "shutdown")
    public ExecutorService iterationExecutor(@Value("${app.iteration.parallelism:4}") int parallelism) {
        return Executors.newFixedThreadPool(Math.max(1, parallelism));
    }

    @Lazy
    @Bean
    public IterationRunner iterationRunner(ExecutorService iterationExecutor, ObjectMapper objectMapper) {
        return new IterationRunner(iterationExecutor, objectMapper);
    }
}
