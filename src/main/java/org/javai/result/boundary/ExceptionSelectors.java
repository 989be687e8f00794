package org.javai.result.boundary;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * The ordered set of exception types an adapter converts into failures.
 *
 * <p>An exception is selected when it is an instance of any configured type, subtypes included.
 * Selection is checked once per exception, in configuration order.
 *
 * <p>Selectors are validated when they are created, never when a wrapped call runs:
 * an empty set, a {@code null} element or a type that is not a {@link Throwable}
 * fails with {@link IllegalArgumentException}.
 *
 * @param <X> The common supertype of the selected exceptions, used as the failure's error type
 */
public final class ExceptionSelectors<X extends Throwable> {

    private static final ExceptionSelectors<Exception> DEFAULTS = new ExceptionSelectors<>(List.of(Exception.class));

    private final List<Class<? extends X>> types;

    private ExceptionSelectors(List<Class<? extends X>> types) {
        if (types.isEmpty()) {
            throw new IllegalArgumentException("ExceptionSelectors requires one or more exception types");
        }
        for (Class<? extends X> type : types) {
            if (type == null) {
                throw new IllegalArgumentException("ExceptionSelectors requires exception types, got null");
            }
            if (!Throwable.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException(
                        "ExceptionSelectors requires exception types, got " + type.getName());
            }
        }
        this.types = List.copyOf(types);
    }

    /**
     * Returns the default selectors: every {@link Exception}.
     * {@link Error}s are never selected by default.
     */
    public static ExceptionSelectors<Exception> defaults() {
        return DEFAULTS;
    }

    /**
     * Creates selectors for the given exception types.
     *
     * @param types the exception types to select, in matching order
     * @return the validated selectors
     * @throws IllegalArgumentException if no types are given or any type is invalid
     */
    @SafeVarargs
    public static <X extends Throwable> ExceptionSelectors<X> of(Class<? extends X>... types) {
        Objects.requireNonNull(types, "types must not be null");
        return new ExceptionSelectors<>(Arrays.asList(types));
    }

    /**
     * Creates selectors for a collection of exception types.
     *
     * @param types the exception types to select, in iteration order
     * @return the validated selectors
     * @throws IllegalArgumentException if the collection is empty or any type is invalid
     */
    public static <X extends Throwable> ExceptionSelectors<X> of(Collection<? extends Class<? extends X>> types) {
        Objects.requireNonNull(types, "types must not be null");
        return new ExceptionSelectors<>(new ArrayList<>(types));
    }

    /**
     * Creates selectors from fully-qualified class names, resolved with the
     * class loader of this library.
     *
     * @param classNames e.g. {@code "java.io.IOException"}
     * @return the validated selectors
     * @throws IllegalArgumentException if no names are given, a name cannot be resolved,
     *         or a resolved class is not a {@link Throwable}
     */
    public static ExceptionSelectors<Throwable> named(String... classNames) {
        Objects.requireNonNull(classNames, "classNames must not be null");
        List<Class<? extends Throwable>> types = new ArrayList<>(classNames.length);
        for (String className : classNames) {
            types.add(resolve(className));
        }
        return new ExceptionSelectors<>(types);
    }

    /**
     * Returns true if the exception is an instance of any selected type.
     */
    public boolean matches(Throwable throwable) {
        for (Class<? extends X> type : types) {
            if (type.isInstance(throwable)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the selected types in matching order.
     */
    public List<Class<? extends X>> types() {
        return types;
    }

    /**
     * Returns the exception typed as the first selected type it is an instance of.
     */
    X select(Throwable throwable) {
        for (Class<? extends X> type : types) {
            if (type.isInstance(throwable)) {
                return type.cast(throwable);
            }
        }
        throw new IllegalArgumentException("Not a selected exception: " + throwable);
    }

    private static Class<? extends Throwable> resolve(String className) {
        if (className == null || className.isBlank()) {
            throw new IllegalArgumentException("ExceptionSelectors requires exception class names, got blank");
        }
        Class<?> type;
        try {
            type = Class.forName(className.strip(), false, ExceptionSelectors.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Unknown exception class: " + className, e);
        }
        if (!Throwable.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException("ExceptionSelectors requires exception types, got " + type.getName());
        }
        return type.asSubclass(Throwable.class);
    }

    @Override
    public String toString() {
        return "ExceptionSelectors" + types.stream().map(Class::getSimpleName).toList();
    }
}
