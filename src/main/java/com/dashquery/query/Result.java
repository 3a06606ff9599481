package com.dashquery.query;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Either a value or an error.
 *
 * @param <T> Value type
 * @param <E> Error type
 */
public final class Result<T, E> {

    private final T value;
    private final E error;

    private Result(T value, E error) {
        this.value = value;
        this.error = error;
    }

    public static <T, E> Result<T, E> ok(T value) {
        return new Result<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T, E> Result<T, E> err(E error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isErr() {
        return error != null;
    }

    /**
     * @throws NoSuchElementException if this is an error
     */
    public T getValue() {
        if (isErr()) {
            throw new NoSuchElementException("Result is an error: " + error);
        }
        return value;
    }

    /**
     * @throws NoSuchElementException if this is a value
     */
    public E getError() {
        if (isOk()) {
            throw new NoSuchElementException("Result is ok");
        }
        return error;
    }

    public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        return isOk() ? Result.ok(mapper.apply(value)) : Result.err(error);
    }

    public <R> R fold(Function<? super T, ? extends R> onOk, Function<? super E, ? extends R> onErr) {
        return isOk() ? onOk.apply(value) : onErr.apply(error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Result<?, ?> other)) {
            return false;
        }
        return Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + value + ")" : "Err(" + error + ")";
    }
}
