package org.javai.result.boundary;

import java.util.Collection;
import java.util.Objects;
import org.javai.result.Result;
import org.javai.result.ops.AdapterListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapts code that signals failure by throwing into code that returns a {@link Result}.
 *
 * <p>A normal return becomes {@code Success(value)}. An exception matching the adapter's
 * {@link ExceptionSelectors} becomes {@code Failure(exception)}, holding the very exception
 * instance that was thrown. Any other exception propagates unchanged.
 *
 * <p>The adapter is immutable and keeps no state between calls. Wrapping keeps the callable's
 * shape: a {@link ThrowingFunction ThrowingFunction&lt;A, R, E&gt;} becomes a
 * {@code ThrowingFunction<A, Result<R, X>, E>}, so the parameter types stay intact and a
 * checked exception the selectors do not cover is still declared.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ResultAdapter<NumberFormatException> parsing = ResultAdapter.catching(NumberFormatException.class);
 *
 * ThrowingFunction<String, Result<Integer, NumberFormatException>, RuntimeException> parse =
 *     parsing.wrap(text -> Integer.parseInt(text));
 *
 * parse.apply("12");   // Success(12)
 * parse.apply("abc");  // Failure(java.lang.NumberFormatException: For input string: "abc")
 * }</pre>
 *
 * @param <X> The error type of the produced failures
 */
public final class ResultAdapter<X extends Throwable> {

    private static final Logger LOG = LoggerFactory.getLogger(ResultAdapter.class);
    private static final String UNNAMED_OPERATION = "unnamed";

    private final ExceptionTriage<X> triage;

    private ResultAdapter(ExceptionTriage<X> triage) {
        this.triage = triage;
    }

    /**
     * Creates an adapter converting every {@link Exception} into a failure.
     * {@link Error}s always propagate.
     */
    public static ResultAdapter<Exception> create() {
        return of(ExceptionSelectors.defaults());
    }

    /**
     * Creates an adapter converting the given exception types, and their subtypes, into failures.
     *
     * @param types the exception types to convert
     * @return the adapter
     * @throws IllegalArgumentException if no types are given or any type is invalid
     */
    @SafeVarargs
    public static <X extends Throwable> ResultAdapter<X> catching(Class<? extends X>... types) {
        return of(ExceptionSelectors.of(types));
    }

    /**
     * Creates an adapter converting a collection of exception types into failures.
     *
     * @param types the exception types to convert
     * @return the adapter
     * @throws IllegalArgumentException if the collection is empty or any type is invalid
     */
    public static <X extends Throwable> ResultAdapter<X> catching(Collection<? extends Class<? extends X>> types) {
        return of(ExceptionSelectors.of(types));
    }

    /**
     * Creates an adapter from prepared selectors.
     *
     * @param selectors the exception selectors
     * @return the adapter
     */
    public static <X extends Throwable> ResultAdapter<X> of(ExceptionSelectors<X> selectors) {
        Objects.requireNonNull(selectors, "selectors must not be null");
        return new ResultAdapter<>(new ExceptionTriage<>(selectors, AdapterListener.noOp(), LOG));
    }

    /**
     * Returns a copy of this adapter that notifies the given listener of every
     * captured and propagated exception.
     *
     * @param listener the listener to notify
     * @return a new adapter with the same selectors
     */
    public ResultAdapter<X> withListener(AdapterListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        return new ResultAdapter<>(triage.withListener(listener));
    }

    public ExceptionSelectors<X> selectors() {
        return triage.selectors();
    }

    /**
     * Executes work immediately, translating a selected exception into a failure.
     *
     * @param operation The operation name for logging and listeners
     * @param work The work to execute
     * @return Success with the returned value, or Failure with the selected exception
     * @throws E if the work throws a checked exception the selectors do not cover
     */
    public <R, E extends Exception> Result<R, X> call(String operation, ThrowingSupplier<R, E> work) throws E {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        R value;
        try {
            value = work.get();
        } catch (Throwable t) {
            if (triage.selects(t)) {
                return triage.capture(operation, t);
            }
            triage.propagating(operation, t);
            throw t;
        }
        return Result.success(value);
    }

    /**
     * Wraps a supplier so that it returns a {@link Result}.
     */
    public <R, E extends Exception> ThrowingSupplier<Result<R, X>, E> wrap(ThrowingSupplier<R, E> work) {
        return wrap(UNNAMED_OPERATION, work);
    }

    public <R, E extends Exception> ThrowingSupplier<Result<R, X>, E> wrap(String operation, ThrowingSupplier<R, E> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return () -> call(operation, work);
    }

    /**
     * Wraps a one-argument function so that it returns a {@link Result}.
     * The argument is forwarded unchanged.
     */
    public <A, R, E extends Exception> ThrowingFunction<A, Result<R, X>, E> wrap(ThrowingFunction<A, R, E> work) {
        return wrap(UNNAMED_OPERATION, work);
    }

    public <A, R, E extends Exception> ThrowingFunction<A, Result<R, X>, E> wrap(String operation, ThrowingFunction<A, R, E> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return argument -> call(operation, () -> work.apply(argument));
    }

    /**
     * Wraps a two-argument function so that it returns a {@link Result}.
     * Both arguments are forwarded unchanged.
     */
    public <A, B, R, E extends Exception> ThrowingBiFunction<A, B, Result<R, X>, E> wrap(ThrowingBiFunction<A, B, R, E> work) {
        return wrap(UNNAMED_OPERATION, work);
    }

    public <A, B, R, E extends Exception> ThrowingBiFunction<A, B, Result<R, X>, E> wrap(String operation, ThrowingBiFunction<A, B, R, E> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return (first, second) -> call(operation, () -> work.apply(first, second));
    }

    /**
     * Wraps an action with no return value. Completing normally yields the marker
     * success {@code Success(true)}.
     */
    public <E extends Exception> ThrowingSupplier<Result<Boolean, X>, E> wrapAction(ThrowingRunnable<E> work) {
        return wrapAction(UNNAMED_OPERATION, work);
    }

    public <E extends Exception> ThrowingSupplier<Result<Boolean, X>, E> wrapAction(String operation, ThrowingRunnable<E> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return () -> call(operation, () -> {
            work.run();
            return Boolean.TRUE;
        });
    }

    @Override
    public String toString() {
        return "ResultAdapter" + triage.selectors().types().stream().map(Class::getSimpleName).toList();
    }
}
