package org.javai.result;

import java.util.Objects;

/**
 * The result of an operation that may fail.
 * Either {@link Success} containing a value, or {@link Failure} containing an error.
 *
 * <p>Both variants are immutable records holding a single payload. Equality is
 * structural and variant-aware: {@code Result.success(1)} never equals
 * {@code Result.failure(1)}. Callers dispatch on the variant with type patterns:
 *
 * <pre>{@code
 * Result<User, IOException> result = adapter.call("UserApi.fetch", () -> api.fetch(id));
 *
 * if (result instanceof Result.Success<User, IOException> s) {
 *     render(s.value());
 * } else if (result instanceof Result.Failure<User, IOException> f) {
 *     log(f.error());
 * }
 * }</pre>
 *
 * @param <T> The type of the successful value
 * @param <E> The type of the error
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    /**
     * A successful result containing a value.
     *
     * @param value the successful value (may be null)
     */
    record Success<T, E>(T value) implements Result<T, E> {

        private static final int DISCRIMINATOR = 1231;

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public T unwrapOr(T defaultValue) {
            return value;
        }

        @Override
        public E err() {
            throw new UnwrapFailedException(this, "Called `Result.err()` on a `Success` value");
        }

        @Override
        public int hashCode() {
            return 31 * DISCRIMINATOR + Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return ResultFormat.format(this);
        }
    }

    /**
     * A failed result containing an error.
     *
     * @param error the error (may be null)
     */
    record Failure<T, E>(E error) implements Result<T, E> {

        private static final int DISCRIMINATOR = 1237;

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }

        @Override
        public T unwrap() {
            throw new UnwrapFailedException(this, "Called `Result.unwrap()` on a `Failure` value");
        }

        @Override
        public T unwrapOr(T defaultValue) {
            return defaultValue;
        }

        @Override
        public E err() {
            return error;
        }

        @Override
        public int hashCode() {
            return 31 * DISCRIMINATOR + Objects.hashCode(error);
        }

        @Override
        public String toString() {
            return ResultFormat.format(this);
        }
    }

    // Query methods
    boolean isSuccess();
    boolean isFailure();

    // Value extraction

    /**
     * Returns the successful value.
     *
     * @throws UnwrapFailedException if this is a {@link Failure}
     */
    T unwrap();

    /**
     * Returns the successful value, or {@code defaultValue} if this is a {@link Failure}.
     * A {@link Success} ignores the default.
     */
    T unwrapOr(T defaultValue);

    /**
     * Returns the error.
     *
     * @throws UnwrapFailedException if this is a {@link Success}
     */
    E err();

    // Static factories

    /**
     * Creates a marker success for operations whose success carries no data.
     * The payload is {@link Boolean#TRUE}.
     */
    static <E> Result<Boolean, E> success() {
        return new Success<>(Boolean.TRUE);
    }

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }

    /**
     * Tests whether the given object is a result of either variant.
     * Useful where values arrive untyped, e.g. from reflection or collections of {@code Object}.
     *
     * @param candidate the object to test (may be null)
     * @return true if {@code candidate} is a {@link Success} or a {@link Failure}
     */
    static boolean isResult(Object candidate) {
        return candidate instanceof Result<?, ?>;
    }
}
