package com.metricinsight.core.detection;

import com.metricinsight.core.config.AnalysisConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link DetectionMethod} instances from method names.
 *
 * <p>
 * This is the single point of extension when adding new detection methods:
 * register the new name here and in {@link AnalysisConfig#KNOWN_METHODS}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionMethodFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionMethodFactory.class);

    private DetectionMethodFactory() {
        // utility class — not instantiable
    }

    /**
     * Create a detection method by name.
     *
     * @param name   method name ({@code zscore}, {@code iqr},
     *               {@code moving_average}); case-insensitive
     * @param config supplies method parameters such as the moving-average
     *               window; must not be {@code null}
     * @return a new method instance
     * @throws NullPointerException     if {@code name} or {@code config} is
     *                                  {@code null}
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DetectionMethod create(String name, AnalysisConfig config) {
        Objects.requireNonNull(name, "Method name must not be null");
        Objects.requireNonNull(config, "AnalysisConfig must not be null");

        return switch (name.toLowerCase(Locale.ROOT)) {
            case ZScoreMethod.NAME -> new ZScoreMethod();
            case IqrMethod.NAME -> new IqrMethod();
            case MovingAverageMethod.NAME -> new MovingAverageMethod(config.getMovingAverageWindow());
            default -> throw new IllegalArgumentException(
                    "Unknown detection method: '" + name
                            + "'. Supported methods: zscore, iqr, moving_average");
        };
    }

    /**
     * Create one method per name, in the given order.
     *
     * @param names  method names; must not be {@code null}
     * @param config supplies method parameters; must not be {@code null}
     * @return unmodifiable list of methods
     */
    public static List<DetectionMethod> createAll(List<String> names, AnalysisConfig config) {
        Objects.requireNonNull(names, "Method names must not be null");
        LOG.debug("Creating {} detection method(s): {}", names.size(), names);
        List<DetectionMethod> methods = names.stream()
                .map(name -> create(name, config))
                .toList();
        return Collections.unmodifiableList(methods);
    }
}
