package org.javai.result.boundary;

/**
 * A supplier that may throw a checked exception.
 * Used by {@link ResultAdapter} and {@link AsyncResultAdapter} to wrap calls that signal failure by throwing.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
