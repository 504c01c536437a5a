package com.adlanda.codecontext.service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Partial-failure mapping: one failing item never stops the rest of the batch.
 * Used for fragments within a file and for files within a session.
 */
public final class BestEffort {

    private BestEffort() {
    }

    /**
     * Applies {@code fn} to each item in order, collecting results and failures separately.
     */
    public static <T, R> BestEffortResult<T, R> map(List<T> items, Function<? super T, ? extends R> fn) {
        List<BestEffortResult.Success<T, R>> successes = new ArrayList<>();
        List<BestEffortResult.Failure<T>> failures = new ArrayList<>();

        for (T item : items) {
            try {
                successes.add(new BestEffortResult.Success<>(item, fn.apply(item)));
            } catch (RuntimeException e) {
                failures.add(new BestEffortResult.Failure<>(item, e));
            }
        }

        return new BestEffortResult<>(successes, failures);
    }
}
