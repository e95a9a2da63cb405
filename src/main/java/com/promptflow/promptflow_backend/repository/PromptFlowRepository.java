package com.promptflow.promptflow_backend.repository;

import com.promptflow.promptflow_backend.model.domain.PromptFlow;

import java.util.List;
import java.util.Optional;

/** Storage for saved flows. Implementations return copies, never live instances. */
public interface PromptFlowRepository {

    List<PromptFlow> findAll();

    Optional<PromptFlow> findById(String id);

    boolean existsById(String id);

    PromptFlow save(PromptFlow flow);

    void deleteById(String id);
}
