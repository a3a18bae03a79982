package com.xammer.iamrisk.service.risk;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of a step that may fall back to a substitute value. A degraded outcome still
 * carries a usable value together with the reason the normal path was not taken.
 *
 * @param <T> the value type
 */
public final class AnalysisOutcome<T> {

    private final T value;
    private final String degradedReason;

    private AnalysisOutcome(T value, String degradedReason) {
        this.value = value;
        this.degradedReason = degradedReason;
    }

    public static <T> AnalysisOutcome<T> success(T value) {
        return new AnalysisOutcome<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> AnalysisOutcome<T> degraded(T fallback, String reason) {
        return new AnalysisOutcome<>(fallback, reason == null ? "Unknown error" : reason);
    }

    public boolean isDegraded() {
        return degradedReason != null;
    }

    public T getValue() {
        return value;
    }

    public String getDegradedReason() {
        return degradedReason;
    }

    public <R> AnalysisOutcome<R> map(Function<? super T, ? extends R> mapper) {
        R mapped = mapper.apply(value);
        return isDegraded() ? degraded(mapped, degradedReason) : success(mapped);
    }

    @Override
    public String toString() {
        return isDegraded() ? "Degraded[" + degradedReason + "]" : "Success[" + value + "]";
    }
}
