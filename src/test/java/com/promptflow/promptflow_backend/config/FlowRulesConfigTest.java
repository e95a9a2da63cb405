package com.promptflow.promptflow_backend.config;

import com.promptflow.promptflow_backend.engine.IterationRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ConfigurableApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class FlowRulesConfigTest {

    @Autowired
    private ConfigurableApplicationContext context;

    @Test
    void iterationExecutor_shouldStartOnlyWhenRunnerIsRequested() {
        assertThat(context.getBeanFactory().containsSingleton("iterationExecutor")).isFalse();

        IterationRunner runner = context.getBean(IterationRunner.class);

        assertThat(runner).isNotNull();
        assertThat(context.getBeanFactory().containsSingleton("iterationExecutor")).isTrue();
    }
}
