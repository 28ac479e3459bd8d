package com.metricinsight.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisConfig#validate()}.
 */
class AnalysisConfigTest {

    @Test
    @DisplayName("Defaults should be valid")
    void defaultsShouldBeValid() {
        assertThatCode(() -> new AnalysisConfig().validate()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should accept method names case-insensitively")
    void shouldAcceptMixedCaseMethods() {
        AnalysisConfig config = new AnalysisConfig();
        config.setAnomalyMethods(List.of("ZScore", "IQR"));

        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should reject an empty method list")
    void shouldRejectEmptyMethods() {
        AnalysisConfig config = new AnalysisConfig();
        config.setAnomalyMethods(List.of());

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("anomalyMethods");
    }

    @Test
    @DisplayName("Should reject inverted severity thresholds")
    void shouldRejectInvertedScores() {
        AnalysisConfig config = new AnalysisConfig();
        config.setModerateScore(0.9);
        config.setSevereScore(0.6);

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("moderateScore");
    }

    @Test
    @DisplayName("Should reject unordered CV bands")
    void shouldRejectUnorderedCvBands() {
        AnalysisConfig config = new AnalysisConfig();
        config.setLowCv(60);

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("CV bands");
    }

    @Test
    @DisplayName("Should list every violation in one message")
    void shouldCollectAllErrors() {
        AnalysisConfig config = new AnalysisConfig();
        config.setMaxLag(-1);
        config.setChangePointWindow(1);
        config.setHistogramBuckets(0);

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("maxLag")
                .hasMessageContaining("changePointWindow")
                .hasMessageContaining("histogramBuckets");
    }

    @Test
    @DisplayName("Sample interval should be expressed as a Duration")
    void shouldExposeSampleIntervalAsDuration() {
        AnalysisConfig config = new AnalysisConfig();
        config.setSampleIntervalMinutes(15);

        assertThat(config.getSampleInterval().toMinutes()).isEqualTo(15);
    }
}
