package org.javai.result.ops;

/**
 * Observes the exception decisions made by the result adapters.
 * Implementations might emit structured logs or metrics.
 */
public interface AdapterListener {

    /**
     * Called when a selected exception was converted into a failure.
     *
     * @param operation The operation name given to the adapter
     * @param exception The exception now held by the failure
     */
    void captured(String operation, Throwable exception);

    /**
     * Called when an exception did not match the selectors and is propagated unchanged.
     *
     * @param operation The operation name given to the adapter
     * @param exception The propagated exception
     */
    default void propagated(String operation, Throwable exception) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A listener that does nothing.
     */
    static AdapterListener noOp() {
        return (operation, exception) -> {};
    }

    /**
     * Creates a composite listener that fans out to all given listeners.
     *
     * @param listeners the listeners to delegate to
     * @return a composite listener
     */
    static AdapterListener composite(AdapterListener... listeners) {
        return CompositeAdapterListener.of(listeners);
    }
}
