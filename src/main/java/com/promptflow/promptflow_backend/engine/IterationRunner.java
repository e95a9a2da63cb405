package com.promptflow.promptflow_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.promptflow.promptflow_backend.model.node.IterationMode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs a ForEach body over a collection.
 * <ul>
 *   <li>SEQUENTIAL: one item at a time, in order; each call sees the results produced so far.</li>
 *   <li>PARALLEL: all items submitted to the executor at once; results come back in input order.</li>
 * </ul>
 * Execution back ends use this to honour a node's iteration mode.
 */
@Slf4j
public class IterationRunner {

    @FunctionalInterface
    public interface IterationBody<T, R> {
        /** {@code previous} is empty in parallel mode. */
        R apply(T item, int index, List<R> previous);
    }

    private final Executor executor;
    private final ObjectMapper objectMapper;

    public IterationRunner(Executor executor, ObjectMapper objectMapper) {
        this.executor = executor;
        this.objectMapper = objectMapper;
    }

    public <T, R> CompletableFuture<List<R>> run(IterationMode mode, List<T> items, IterationBody<T, R> body) {
        if (mode == IterationMode.PARALLEL) {
            return runParallel(items, body);
        }
        try {
            return CompletableFuture.completedFuture(runSequential(items, body));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public <T, R> List<R> runSequential(List<T> items, IterationBody<T, R> body) {
        List<R> results = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            results.add(body.apply(items.get(i), i, Collections.unmodifiableList(new ArrayList<>(results))));
        }
        return results;
    }

    /** The first failing item fails the whole run. */
    public <T, R> CompletableFuture<List<R>> runParallel(List<T> items, IterationBody<T, R> body) {
        List<CompletableFuture<R>> futures = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            final int index = i;
            final T item = items.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> body.apply(item, index, List.of()), executor));
        }
        log.debug("Submitted {} parallel iteration(s)", futures.size());
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(done -> futures.stream().map(CompletableFuture::join).toList());
    }

    /**
     * Turns a ForEach source value into the items to iterate: collections and arrays as-is,
     * a JSON array string parsed, any other text split into its non-blank lines.
     */
    public List<Object> resolveItems(Object source) {
        if (source == null) return List.of();
        if (source instanceof Collection<?> collection) return new ArrayList<>(collection);
        if (source instanceof Object[] array) return Arrays.asList(array);
        if (source instanceof String text) {
            String trimmed = text.trim();
            if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
                try {
                    return objectMapper.readValue(trimmed, new TypeReference<List<Object>>() {});
                } catch (JsonProcessingException e) {
                    log.debug("Source looked like a JSON array but did not parse, splitting lines instead");
                }
            }
            return trimmed.lines()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .map(line -> (Object) line)
                    .toList();
        }
        return List.of(source);
    }
}
