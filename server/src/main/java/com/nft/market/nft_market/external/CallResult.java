package com.nft.market.nft_market.external;

import java.util.function.Function;

/**
 * Outcome of an external call: a value or a classified failure, never both.
 */
public final class CallResult<T> {

    private final T value;
    private final CallFailure failure;

    private CallResult(T value, CallFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    static <T> CallResult<T> success(T value) {
        return new CallResult<>(value, null);
    }

    static <T> CallResult<T> failure(CallFailure failure) {
        return new CallResult<>(null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public boolean isFailure() {
        return failure != null;
    }

    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("Call failed: " + failure.describe());
        }
        return value;
    }

    public CallFailure getFailure() {
        return failure;
    }

    public T orElseThrow(Function<CallFailure, ? extends RuntimeException> onFailure) {
        if (failure != null) {
            throw onFailure.apply(failure);
        }
        return value;
    }

    /**
     * Value on success, the fallback on any failure.
     */
    public T orElse(T fallback) {
        return failure == null ? value : fallback;
    }
}
