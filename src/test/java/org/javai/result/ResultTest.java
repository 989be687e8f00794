package org.javai.result;

import org.junit.jupiter.api.Test;

import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class ResultTest {

    @Test
    void equals_sameVariantAndPayload_isEqual() {
        assertThat(Result.success(1)).isEqualTo(Result.success(1));
        assertThat(Result.failure(1)).isEqualTo(Result.failure(1));
    }

    @Test
    void equals_differentVariantSamePayload_isNotEqual() {
        assertThat(Result.<Integer, Integer>success(1)).isNotEqualTo(Result.<Integer, Integer>failure(1));
        assertThat(Result.<String, String>failure("a")).isNotEqualTo(Result.<String, String>success("a"));
    }

    @Test
    void equals_differentPayload_isNotEqual() {
        assertThat(Result.success(1)).isNotEqualTo(Result.success(2));
        assertThat(Result.failure(1)).isNotEqualTo(Result.failure(2));
        assertThat(Result.success("0")).isNotEqualTo(Result.success(0));
    }

    @Test
    void equals_unrelatedType_isNotEqual() {
        assertThat(Result.success(1).equals("abc")).isFalse();
        assertThat(Result.failure(1).equals(null)).isFalse();
    }

    @Test
    void hashCode_equalValues_hashEqually() {
        assertThat(Result.success("x").hashCode()).isEqualTo(Result.success("x").hashCode());
        assertThat(Result.failure("x").hashCode()).isEqualTo(Result.failure("x").hashCode());
    }

    @Test
    void hashCode_variantsWithSamePayload_differ() {
        assertThat(Result.success("a").hashCode()).isNotEqualTo(Result.failure("a").hashCode());
    }

    @Test
    void set_collapsesEqualResults() {
        Set<Result<Integer, String>> results = Set.copyOf(List.of(
                Result.success(1), Result.failure("2"), Result.success(1), Result.failure("2")));

        assertThat(results).hasSize(2);
        assertThat(Set.of(Result.success(1), Result.success(2))).hasSize(2);
        assertThat(Set.of(Result.<String, String>success("a"), Result.<String, String>failure("a"))).hasSize(2);
    }

    @Test
    void map_usesResultsAsKeys() {
        Map<Result<Integer, String>, String> labels = new HashMap<>();
        labels.put(Result.success(200), "ok");
        labels.put(Result.failure("timeout"), "retry");

        assertThat(labels.get(Result.success(200))).isEqualTo("ok");
        assertThat(labels.get(Result.failure("timeout"))).isEqualTo("retry");
        assertThat(labels.get(Result.failure("200"))).isNull();
    }

    @Test
    void success_withoutValue_holdsTrue() {
        Result<Boolean, String> marker = Result.success();

        assertThat(marker.isSuccess()).isTrue();
        assertThat(marker.unwrap()).isTrue();
        assertThat(marker).isEqualTo(Result.success(true));
    }

    @Test
    void success_acceptsNullValue() {
        Result<String, String> result = Result.success(null);

        assertThat(result.unwrap()).isNull();
        assertThat(result).isEqualTo(Result.success(null));
    }

    @Test
    void failure_nullError_isAnOrdinaryFailure() {
        Result<String, Object> failure = Result.failure(null);

        assertThat(failure).isEqualTo(Result.failure(null));
        assertThat(failure.hashCode()).isEqualTo(Result.failure(null).hashCode());
        assertThat(failure.err()).isNull();
        assertThat(failure.isFailure()).isTrue();
        assertThat(failure).isNotEqualTo(Result.success(null));
        assertThat(failure.toString()).isEqualTo("Failure(null)");
    }

    @Test
    void success_unwrap_returnsValue() {
        assertThat(Result.success("yay").unwrap()).isEqualTo("yay");
    }

    @Test
    void failure_unwrap_throwsUnwrapFailed() {
        Result<String, String> failure = Result.failure("nay");

        assertThatThrownBy(failure::unwrap)
                .isInstanceOf(UnwrapFailedException.class)
                .hasMessage("Called `Result.unwrap()` on a `Failure` value");
    }

    @Test
    void failure_unwrap_keepsOriginalResult() {
        Result<String, String> failure = Result.failure("nay");

        UnwrapFailedException thrown = catchThrowableOfType(UnwrapFailedException.class, failure::unwrap);

        assertThat(thrown.result()).isSameAs(failure);
    }

    @Test
    void unwrapOr_successIgnoresDefault() {
        assertThat(Result.success("yay").unwrapOr("some_default")).isEqualTo("yay");
    }

    @Test
    void unwrapOr_failureReturnsDefault() {
        Result<String, String> failure = Result.failure("nay");

        assertThat(failure.unwrapOr("another_default")).isEqualTo("another_default");
    }

    @Test
    void failure_err_returnsError() {
        IllegalStateException error = new IllegalStateException("boom");

        assertThat(Result.failure(error).err()).isSameAs(error);
    }

    @Test
    void success_err_throwsUnwrapFailed() {
        Result<String, String> success = Result.success("yay");

        assertThatThrownBy(success::err)
                .isInstanceOf(UnwrapFailedException.class)
                .hasMessage("Called `Result.err()` on a `Success` value")
                .extracting(e -> ((UnwrapFailedException) e).result())
                .isSameAs(success);
    }

    @Test
    void isSuccess_isFailure_reportVariant() {
        assertThat(Result.success(1).isSuccess()).isTrue();
        assertThat(Result.success(1).isFailure()).isFalse();
        assertThat(Result.failure(1).isSuccess()).isFalse();
        assertThat(Result.failure(1).isFailure()).isTrue();
    }

    @Test
    void isResult_recognisesBothVariants() {
        assertThat(Result.isResult(Result.success("yay"))).isTrue();
        assertThat(Result.isResult(Result.failure("nay"))).isTrue();
        assertThat(Result.isResult(1)).isFalse();
        assertThat(Result.isResult(null)).isFalse();
    }

    @Test
    void variants_holdExactlyOneFinalComponent() {
        for (Class<?> variant : List.of(Result.Success.class, Result.Failure.class)) {
            assertThat(variant.isRecord()).isTrue();
            assertThat(Modifier.isFinal(variant.getModifiers())).isTrue();

            RecordComponent[] components = variant.getRecordComponents();
            assertThat(components).hasSize(1);
            assertThat(variant.getDeclaredFields())
                    .filteredOn(f -> !Modifier.isStatic(f.getModifiers()))
                    .hasSize(1)
                    .allMatch(f -> Modifier.isFinal(f.getModifiers()));
        }
    }

    @Test
    void resultType_permitsOnlyTwoVariants() {
        assertThat(Result.class.isSealed()).isTrue();
        assertThat(Result.class.getPermittedSubclasses())
                .containsExactlyInAnyOrder(Result.Success.class, Result.Failure.class);
    }

    @Test
    void typePattern_successExposesValue() {
        Result<String, Integer> result = Result.success("yay");

        String reached = null;
        if (result instanceof Result.Success<String, Integer> success) {
            reached = success.value();
        }

        assertThat(reached).isEqualTo("yay");
    }

    @Test
    void typePattern_failureExposesError() {
        Result<Integer, String> result = Result.failure("nay");

        String reached = null;
        if (result instanceof Result.Failure<Integer, String> failure) {
            reached = failure.error();
        }

        assertThat(reached).isEqualTo("nay");
    }

    @Test
    void toString_rendersVariantAndPayload() {
        assertThat(Result.success(123)).hasToString("Success(123)");
        assertThat(Result.failure(-1)).hasToString("Failure(-1)");
        assertThat(Result.failure("nay")).hasToString("Failure(\"nay\")");
    }
}
