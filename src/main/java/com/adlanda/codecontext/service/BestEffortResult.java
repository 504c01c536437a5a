package com.adlanda.codecontext.service;

import java.util.List;

/**
 * Outcome of applying a function to every item of a batch where individual
 * items may fail.
 *
 * @param successes Items that succeeded with their results, in input order
 * @param failures  Items that failed with their errors, in input order
 */
public record BestEffortResult<T, R>(List<Success<T, R>> successes, List<Failure<T>> failures) {

    public BestEffortResult {
        successes = List.copyOf(successes);
        failures = List.copyOf(failures);
    }

    public List<R> results() {
        return successes.stream().map(Success::result).toList();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public record Success<T, R>(T item, R result) {}

    public record Failure<T>(T item, RuntimeException error) {}
}
