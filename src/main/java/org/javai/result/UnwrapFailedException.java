package org.javai.result;

import java.util.Objects;

/**
 * Thrown when a variant-specific accessor is called on the wrong variant:
 * {@link Result#unwrap()} on a failure, or {@link Result#err()} on a success.
 * This is an unchecked exception because it indicates misuse of the API;
 * the caller should have checked {@link Result#isSuccess()} first or used a type pattern.
 *
 * <p>The offending result is kept for diagnostics. It is typed {@code Result<?, ?>}
 * because the variant that throws only knows one of its two type arguments.
 */
public class UnwrapFailedException extends RuntimeException {

    private final Result<?, ?> result;

    public UnwrapFailedException(Result<?, ?> result, String message) {
        super(message);
        this.result = Objects.requireNonNull(result, "result must not be null");
    }

    /**
     * Returns the result that was misused. This is the identical instance, not a copy.
     */
    public Result<?, ?> result() {
        return result;
    }
}
