package com.metricinsight.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisResult}.
 */
class AnalysisResultTest {

    @Test
    @DisplayName("Successful result should expose and map its value")
    void successfulResultShouldMap() {
        AnalysisResult<Integer> result = AnalysisResult.of(21);

        assertThat(result.isSufficient()).isTrue();
        assertThat(result.getInsufficientData()).isEmpty();
        assertThat(result.map(v -> v * 2).get()).isEqualTo(42);
    }

    @Test
    @DisplayName("Insufficient result should carry its reason through map and refuse get")
    void insufficientResultShouldPassThrough() {
        AnalysisResult<Integer> result = AnalysisResult.insufficientData(2, 1, "needs two samples");
        AnalysisResult<String> mapped = result.map(String::valueOf);

        assertThat(mapped.isSufficient()).isFalse();
        assertThat(mapped.value()).isEmpty();
        assertThat(mapped.getInsufficientData()).hasValueSatisfying(missing -> {
            assertThat(missing.getRequired()).isEqualTo(2);
            assertThat(missing.getActual()).isEqualTo(1);
            assertThat(missing.getReason()).isEqualTo("needs two samples");
        });
        assertThatThrownBy(mapped::get)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("needs two samples");
    }
}
