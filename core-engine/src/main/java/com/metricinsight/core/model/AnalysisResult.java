package com.metricinsight.core.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of an analysis entry point: either a computed value or an
 * {@link InsufficientData} descriptor.
 *
 * <p>
 * Short or empty input is a normal data condition, not a programming error,
 * so analyzers report it through this type instead of throwing. Malformed
 * input (mismatched lengths, duplicate timestamps, out-of-range parameters)
 * still fails fast with an exception.
 * </p>
 *
 * @param <T> type of the computed value
 * @since 1.0.0
 */
public final class AnalysisResult<T> {

    private final T value;
    private final InsufficientData insufficientData;

    private AnalysisResult(T value, InsufficientData insufficientData) {
        this.value = value;
        this.insufficientData = insufficientData;
    }

    /**
     * @param value computed value; must not be {@code null}
     * @return a successful result
     */
    public static <T> AnalysisResult<T> of(T value) {
        return new AnalysisResult<>(Objects.requireNonNull(value, "value must not be null"), null);
    }

    /**
     * @param required minimum sample count the analysis needs
     * @param actual   sample count supplied
     * @param reason   short description of the missing data
     * @return an insufficient-data result
     */
    public static <T> AnalysisResult<T> insufficientData(int required, int actual, String reason) {
        return new AnalysisResult<>(null, new InsufficientData(required, actual, reason));
    }

    public boolean isSufficient() {
        return value != null;
    }

    /**
     * @return the computed value
     * @throws IllegalStateException if the analysis reported insufficient data
     */
    public T get() {
        if (value == null) {
            throw new IllegalStateException("No value: " + insufficientData);
        }
        return value;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public Optional<InsufficientData> getInsufficientData() {
        return Optional.ofNullable(insufficientData);
    }

    /**
     * Transform the value, passing insufficient-data results through.
     *
     * @param mapper value transformation; must not return {@code null}
     * @return mapped result
     */
    public <R> AnalysisResult<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        if (value == null) {
            return new AnalysisResult<>(null, insufficientData);
        }
        return AnalysisResult.of(mapper.apply(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnalysisResult<?> that))
            return false;
        return Objects.equals(value, that.value)
                && Objects.equals(insufficientData, that.insufficientData);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, insufficientData);
    }

    @Override
    public String toString() {
        return value != null
                ? "AnalysisResult{" + value + '}'
                : "AnalysisResult{" + insufficientData + '}';
    }
}
