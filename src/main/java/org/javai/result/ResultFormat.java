package org.javai.result;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes and reads the debug representation of a {@link Result}.
 *
 * <p>The representation is the variant name followed by the payload literal in
 * parentheses, e.g. {@code Success(123)}, {@code Failure("nay")} or
 * {@code Success(Failure(-1))}. {@link #parse(String)} reconstructs an equal result
 * for these payloads:
 * <ul>
 *   <li>{@code String}, {@code Boolean}, {@code Integer}, finite {@code Double} and {@code null},
 *       written as JSON literals ({@code "nay"}, {@code true}, {@code 123}, {@code 2.5}, {@code null})</li>
 *   <li>{@code Long} and finite {@code Float}, written with a Java suffix ({@code 5L}, {@code 2.5F})</li>
 *   <li>results nested inside results</li>
 * </ul>
 *
 * <p>Any other number, including {@code NaN} and infinities, is written with its type name,
 * e.g. {@code Success(BigDecimal("1.50"))}, and any other payload with
 * {@link String#valueOf(Object)}. {@code parse} rejects both forms rather than
 * return a result of a different payload type.
 */
public final class ResultFormat {

    private static final String SUCCESS = "Success";
    private static final String FAILURE = "Failure";
    private static final Pattern FORM = Pattern.compile("(" + SUCCESS + "|" + FAILURE + ")\\((.*)\\)", Pattern.DOTALL);
    private static final Pattern LONG_LITERAL = Pattern.compile("-?\\d+L");
    private static final Pattern FLOAT_LITERAL = Pattern.compile("-?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?F");

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private ResultFormat() {}

    /**
     * Returns the debug representation of a result.
     *
     * @param result the result to format
     * @return e.g. {@code Success(123)}
     */
    public static String format(Result<?, ?> result) {
        Objects.requireNonNull(result, "result must not be null");
        if (result instanceof Result.Success<?, ?> success) {
            return SUCCESS + "(" + literal(success.value()) + ")";
        }
        Result.Failure<?, ?> failure = (Result.Failure<?, ?>) result;
        return FAILURE + "(" + literal(failure.error()) + ")";
    }

    /**
     * Reconstructs a result from its debug representation.
     *
     * @param text a representation produced by {@link #format(Result)}
     * @return a result equal to the one that was formatted
     * @throws IllegalArgumentException if the text is not a readable representation
     */
    public static Result<Object, Object> parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        Matcher matcher = FORM.matcher(text.strip());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a result representation: " + text);
        }
        Object payload = readLiteral(matcher.group(2));
        if (SUCCESS.equals(matcher.group(1))) {
            return Result.success(payload);
        }
        return Result.failure(payload);
    }

    private static String literal(Object payload) {
        if (payload instanceof Result<?, ?> nested) {
            return format(nested);
        }
        if (payload instanceof Long) {
            return payload + "L";
        }
        if (payload instanceof Float f) {
            return Float.isFinite(f) ? f + "F" : typed(f);
        }
        if (payload instanceof Double d && !Double.isFinite(d)) {
            return typed(d);
        }
        if (payload instanceof Number number && !(payload instanceof Integer || payload instanceof Double)) {
            return typed(number);
        }
        if (payload == null || payload instanceof CharSequence || payload instanceof Number || payload instanceof Boolean) {
            return json(payload instanceof CharSequence ? payload.toString() : payload);
        }
        return String.valueOf(payload);
    }

    private static String typed(Number number) {
        return number.getClass().getSimpleName() + "(" + json(number.toString()) + ")";
    }

    private static String json(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot write payload literal " + value, e);
        }
    }

    private static Object readLiteral(String literal) {
        String trimmed = literal.strip();
        if (trimmed.startsWith(SUCCESS + "(") || trimmed.startsWith(FAILURE + "(")) {
            return parse(trimmed);
        }
        if (LONG_LITERAL.matcher(trimmed).matches()) {
            return Long.valueOf(trimmed.substring(0, trimmed.length() - 1));
        }
        if (FLOAT_LITERAL.matcher(trimmed).matches()) {
            return Float.valueOf(trimmed.substring(0, trimmed.length() - 1));
        }
        try {
            return MAPPER.readValue(trimmed, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a readable payload literal: " + literal, e);
        }
    }
}
