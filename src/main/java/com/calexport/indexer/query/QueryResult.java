package com.calexport.indexer.query;

import java.util.Optional;
import java.util.function.Function;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Typed outcome of a query: a value, or a reason why there is none.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class QueryResult<T> {

    public enum Status {
        OK,
        NOT_FOUND,
        INVALID_ARGUMENT
    }

    Status status;
    T value;
    String message;

    public static <T> QueryResult<T> ok(T value) {
        return new QueryResult<>(Status.OK, value, null);
    }

    public static <T> QueryResult<T> notFound(String message) {
        return new QueryResult<>(Status.NOT_FOUND, null, message);
    }

    public static <T> QueryResult<T> invalidArgument(String message) {
        return new QueryResult<>(Status.INVALID_ARGUMENT, null, message);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public <R> QueryResult<R> map(Function<? super T, ? extends R> mapper) {
        return isOk() ? QueryResult.<R>ok(mapper.apply(value)) : new QueryResult<>(status, null, message);
    }
}
