package com.promptflow.promptflow_backend.validation;

import java.util.function.Predicate;

/**
 * Entry of the compatibility table: when {@code restricts} holds for a candidate the
 * connection is refused with {@code message}. Pairs no rule restricts are compatible.
 */
public record CompatibilityRule(
        String name,
        Predicate<ConnectionCandidate> restricts,
        String message,
        String suggestion
) {

    public ConnectionResult check(ConnectionCandidate candidate) {
        return restricts.test(candidate)
                ? ConnectionResult.invalid(message, suggestion)
                : ConnectionResult.ok();
    }
}
