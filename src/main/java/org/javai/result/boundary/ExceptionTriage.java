package org.javai.result.boundary;

import org.javai.result.Result;
import org.javai.result.ops.AdapterListener;
import org.slf4j.Logger;

/**
 * Decides, for one exception, whether an adapter converts it into a failure or lets it propagate,
 * and tells the listener and the log which way it went. Shared by both adapters.
 *
 * <p>Whatever a listener throws is logged and never changes the decision, except a
 * {@link VirtualMachineError}, which is rethrown.
 */
final class ExceptionTriage<X extends Throwable> {

    private final ExceptionSelectors<X> selectors;
    private final AdapterListener listener;
    private final Logger log;

    ExceptionTriage(ExceptionSelectors<X> selectors, AdapterListener listener, Logger log) {
        this.selectors = selectors;
        this.listener = listener;
        this.log = log;
    }

    ExceptionSelectors<X> selectors() {
        return selectors;
    }

    ExceptionTriage<X> withListener(AdapterListener listener) {
        return new ExceptionTriage<>(selectors, listener, log);
    }

    boolean selects(Throwable throwable) {
        return selectors.matches(throwable);
    }

    /**
     * Converts a selected exception into a failure holding that same exception.
     */
    <R> Result<R, X> capture(String operation, Throwable throwable) {
        X error = selectors.select(throwable);
        log.debug("Operation [{}] captured {} as failure", operation, throwable.getClass().getName());
        try {
            listener.captured(operation, throwable);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            log.warn("AdapterListener.captured failed for operation [{}]", operation, t);
        }
        return Result.failure(error);
    }

    /**
     * Records that an unselected exception is about to propagate. The caller rethrows it.
     */
    void propagating(String operation, Throwable throwable) {
        log.trace("Operation [{}] propagating unselected {}", operation, throwable.getClass().getName());
        try {
            listener.propagated(operation, throwable);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            log.warn("AdapterListener.propagated failed for operation [{}]", operation, t);
        }
    }
}
