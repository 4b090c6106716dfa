package com.anthem.acctctl.core.bulk;

/**
 * Result of one item of a bulk operation: either a value or an error.
 */
public final class Outcome<T> {

    private final T value;
    private final RuntimeException error;

    private Outcome(T value, RuntimeException error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null);
    }

    public static <T> Outcome<T> failure(RuntimeException error) {
        return new Outcome<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        return value;
    }

    public RuntimeException getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Outcome{value=" + value + "}" : "Outcome{error=" + error.getMessage() + "}";
    }
}
