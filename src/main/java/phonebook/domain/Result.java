package phonebook.domain;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an operation that can fail with a recoverable, typed error.
 *
 * <p>Validation and lookup failures are reported through this type instead of exceptions so
 * callers branch on {@link #isOk()} and inspect the error value directly. Storage failures are
 * not recoverable at the call site and still propagate as exceptions.
 *
 * @param <T> value type on success
 * @param <E> error type on failure
 */
public sealed interface Result<T, E> permits Result.Ok, Result.Err {

    static <T, E> Result<T, E> ok(final T value) {
        return new Ok<>(value);
    }

    static <T, E> Result<T, E> err(final E error) {
        return new Err<>(error);
    }

    /**
     * @return {@code true} when this result carries a value
     */
    boolean isOk();

    /**
     * @return the success value
     * @throws IllegalStateException if this result is an error
     */
    T value();

    /**
     * @return the error value
     * @throws IllegalStateException if this result is a success
     */
    E error();

    default <U> Result<U, E> map(final Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        if (isOk()) {
            return ok(mapper.apply(value()));
        }
        return err(error());
    }

    default <U> Result<U, E> flatMap(final Function<? super T, ? extends Result<U, E>> mapper) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        if (isOk()) {
            return mapper.apply(value());
        }
        return err(error());
    }

    /**
     * Successful outcome.
     *
     * @param value the produced value
     */
    record Ok<T, E>(T value) implements Result<T, E> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public E error() {
            throw new IllegalStateException("Ok result has no error");
        }
    }

    /**
     * Failed outcome.
     *
     * @param error the reported error, never null
     */
    record Err<T, E>(E error) implements Result<T, E> {

        public Err {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("Err result has no value: " + error);
        }
    }
}
