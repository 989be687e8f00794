package org.javai.result.boundary;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import org.javai.result.Result;
import org.javai.result.ops.AdapterListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The asynchronous counterpart of {@link ResultAdapter}: adapts work that completes a
 * {@link CompletionStage} into work that completes with a {@link Result}.
 *
 * <p>The returned future completes with {@code Success(value)} when the stage completes
 * normally, and with {@code Failure(exception)} when it completes exceptionally with a
 * selected exception. Any other exception completes the returned future exceptionally
 * with that same exception. {@link CompletionException} wrappers are removed before
 * selectors are consulted. An exception thrown while obtaining the stage is handled
 * exactly like an exceptional completion.
 *
 * <p>Cancelling the returned future cancels the in-flight stage when it is a {@link Future}.
 * A cancelled future never holds a result. A {@link java.util.concurrent.CancellationException}
 * or {@link java.util.concurrent.TimeoutException} coming from the stage itself is just another
 * exception, converted or propagated according to the selectors.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * AsyncResultAdapter<IOException> adapter = AsyncResultAdapter.catching(IOException.class);
 *
 * CompletableFuture<Result<HttpResponse<String>, IOException>> response =
 *     adapter.call("Orders.fetch", () -> client.sendAsync(request, BodyHandlers.ofString()));
 * }</pre>
 *
 * @param <X> The error type of the produced failures
 */
public final class AsyncResultAdapter<X extends Throwable> {

    private static final Logger LOG = LoggerFactory.getLogger(AsyncResultAdapter.class);
    private static final String UNNAMED_OPERATION = "unnamed";

    private final ExceptionTriage<X> triage;

    private AsyncResultAdapter(ExceptionTriage<X> triage) {
        this.triage = triage;
    }

    /**
     * Creates an adapter converting every {@link Exception} into a failure.
     */
    public static AsyncResultAdapter<Exception> create() {
        return of(ExceptionSelectors.defaults());
    }

    @SafeVarargs
    public static <X extends Throwable> AsyncResultAdapter<X> catching(Class<? extends X>... types) {
        return of(ExceptionSelectors.of(types));
    }

    public static <X extends Throwable> AsyncResultAdapter<X> catching(Collection<? extends Class<? extends X>> types) {
        return of(ExceptionSelectors.of(types));
    }

    public static <X extends Throwable> AsyncResultAdapter<X> of(ExceptionSelectors<X> selectors) {
        Objects.requireNonNull(selectors, "selectors must not be null");
        return new AsyncResultAdapter<>(new ExceptionTriage<>(selectors, AdapterListener.noOp(), LOG));
    }

    /**
     * Returns a copy of this adapter that notifies the given listener.
     */
    public AsyncResultAdapter<X> withListener(AdapterListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        return new AsyncResultAdapter<>(triage.withListener(listener));
    }

    public ExceptionSelectors<X> selectors() {
        return triage.selectors();
    }

    /**
     * Starts the work and returns a future of its result.
     *
     * @param operation The operation name for logging and listeners
     * @param work Produces the stage to await
     * @return a future completing with Success or Failure, or exceptionally with an unselected exception
     */
    public <R> CompletableFuture<Result<R, X>> call(
            String operation,
            ThrowingSupplier<? extends CompletionStage<R>, ? extends Exception> work
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        CompletableFuture<Result<R, X>> outcome = new CompletableFuture<>();
        CompletionStage<R> stage;
        try {
            stage = Objects.requireNonNull(work.get(), "work must not return a null stage");
        } catch (Throwable t) {
            settleExceptionally(operation, outcome, t);
            return outcome;
        }

        stage.whenComplete((value, failure) -> {
            if (outcome.isCancelled()) {
                return;
            }
            try {
                if (failure == null) {
                    outcome.complete(Result.success(value));
                } else {
                    settleExceptionally(operation, outcome, failure);
                }
            } catch (Throwable t) {
                // the stage returned by whenComplete is discarded, so nothing else would observe t
                outcome.completeExceptionally(t);
            }
        });
        outcome.whenComplete((result, failure) -> {
            if (outcome.isCancelled()) {
                cancel(operation, stage);
            }
        });
        return outcome;
    }

    /**
     * Wraps an asynchronous supplier so that its future completes with a {@link Result}.
     */
    public <R> Supplier<CompletableFuture<Result<R, X>>> wrap(
            ThrowingSupplier<? extends CompletionStage<R>, ? extends Exception> work
    ) {
        return wrap(UNNAMED_OPERATION, work);
    }

    public <R> Supplier<CompletableFuture<Result<R, X>>> wrap(
            String operation,
            ThrowingSupplier<? extends CompletionStage<R>, ? extends Exception> work
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return () -> call(operation, work);
    }

    /**
     * Wraps an asynchronous one-argument function. The argument is forwarded unchanged.
     */
    public <A, R> Function<A, CompletableFuture<Result<R, X>>> wrap(
            ThrowingFunction<? super A, ? extends CompletionStage<R>, ? extends Exception> work
    ) {
        return wrap(UNNAMED_OPERATION, work);
    }

    public <A, R> Function<A, CompletableFuture<Result<R, X>>> wrap(
            String operation,
            ThrowingFunction<? super A, ? extends CompletionStage<R>, ? extends Exception> work
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return argument -> call(operation, () -> work.apply(argument));
    }

    /**
     * Wraps an asynchronous two-argument function. Both arguments are forwarded unchanged.
     */
    public <A, B, R> BiFunction<A, B, CompletableFuture<Result<R, X>>> wrap(
            ThrowingBiFunction<? super A, ? super B, ? extends CompletionStage<R>, ? extends Exception> work
    ) {
        return wrap(UNNAMED_OPERATION, work);
    }

    public <A, B, R> BiFunction<A, B, CompletableFuture<Result<R, X>>> wrap(
            String operation,
            ThrowingBiFunction<? super A, ? super B, ? extends CompletionStage<R>, ? extends Exception> work
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        return (first, second) -> call(operation, () -> work.apply(first, second));
    }

    private <R> void settleExceptionally(String operation, CompletableFuture<Result<R, X>> outcome, Throwable failure) {
        Throwable cause = unwrap(failure);
        if (triage.selects(cause)) {
            outcome.complete(triage.capture(operation, cause));
        } else {
            triage.propagating(operation, cause);
            outcome.completeExceptionally(cause);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    private static void cancel(String operation, CompletionStage<?> stage) {
        if (stage instanceof Future<?> future) {
            boolean cancelled = future.cancel(true);
            LOG.debug("Operation [{}] cancelled; in-flight stage cancelled={}", operation, cancelled);
        } else {
            LOG.debug("Operation [{}] cancelled; in-flight {} does not support cancellation",
                    operation, stage.getClass().getName());
        }
    }

    @Override
    public String toString() {
        return "AsyncResultAdapter" + triage.selectors().types().stream().map(Class::getSimpleName).toList();
    }
}
