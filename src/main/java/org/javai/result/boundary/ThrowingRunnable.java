package org.javai.result.boundary;

/**
 * An action with no result that may throw a checked exception.
 *
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingRunnable<E extends Exception> {

    void run() throws E;
}
