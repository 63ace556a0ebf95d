package com.example.tamperdetector.config;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of every calibration knob used by the detector battery. Values are
 * validated on construction; {@link #fromMap(Map)} resolves absent keys to the documented
 * defaults and rejects keys it does not know.
 */
public record ThresholdConfig(
        double elaThreshold,
        int elaQuality,
        double elaMinRegionArea,
        double elaMaxDifference,
        double forgeryConfidence,
        double copyMoveRatio,
        double copyMoveMinDistance,
        int copyMoveMinMatches,
        int copyMoveMinKeypoints,
        double noiseInconsistency,
        double splicingVariation,
        double aiGeneratedThreshold,
        double aiSmoothnessVariance,
        double aiTextureUniformity,
        double aiSensorNoise,
        double frequencyUniformRatio,
        double frequencyIrregularRatio,
        double metadataAnomalyWeight) {

    private static final ThresholdConfig DEFAULTS = fromMap(Map.of());

    public ThresholdConfig {
        Key.ELA_THRESHOLD.check(elaThreshold);
        Key.ELA_QUALITY.check(elaQuality);
        Key.ELA_MIN_REGION_AREA.check(elaMinRegionArea);
        Key.ELA_MAX_DIFFERENCE.check(elaMaxDifference);
        Key.FORGERY_CONFIDENCE.check(forgeryConfidence);
        Key.COPY_MOVE_RATIO.check(copyMoveRatio);
        Key.COPY_MOVE_MIN_DISTANCE.check(copyMoveMinDistance);
        Key.COPY_MOVE_MIN_MATCHES.check(copyMoveMinMatches);
        Key.COPY_MOVE_MIN_KEYPOINTS.check(copyMoveMinKeypoints);
        Key.NOISE_INCONSISTENCY.check(noiseInconsistency);
        Key.SPLICING_VARIATION.check(splicingVariation);
        Key.AI_GENERATED_THRESHOLD.check(aiGeneratedThreshold);
        Key.AI_SMOOTHNESS_VARIANCE.check(aiSmoothnessVariance);
        Key.AI_TEXTURE_UNIFORMITY.check(aiTextureUniformity);
        Key.AI_SENSOR_NOISE.check(aiSensorNoise);
        Key.FREQUENCY_UNIFORM_RATIO.check(frequencyUniformRatio);
        Key.FREQUENCY_IRREGULAR_RATIO.check(frequencyIrregularRatio);
        Key.METADATA_ANOMALY_WEIGHT.check(metadataAnomalyWeight);
        if (frequencyUniformRatio >= frequencyIrregularRatio) {
            throw new IllegalArgumentException(
                    "frequency_uniform_ratio must be lower than frequency_irregular_ratio");
        }
    }

    public static ThresholdConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Builds a snapshot from snake_case keys such as {@code ela_threshold}. Absent keys fall back
     * to their defaults.
     *
     * @throws IllegalArgumentException for unknown keys, non-integral values of integer knobs or
     *                                  values outside a knob's range
     */
    public static ThresholdConfig fromMap(Map<String, ? extends Number> values) {
        Objects.requireNonNull(values, "values");
        Map<Key, Number> resolved = new EnumMap<>(Key.class);
        values.forEach((name, value) -> {
            Key key = Key.of(name);
            if (value == null) {
                throw new IllegalArgumentException("Threshold '" + name + "' must not be null");
            }
            resolved.put(key, value);
        });
        return new ThresholdConfig(
                Key.ELA_THRESHOLD.resolve(resolved),
                Key.ELA_QUALITY.resolveInt(resolved),
                Key.ELA_MIN_REGION_AREA.resolve(resolved),
                Key.ELA_MAX_DIFFERENCE.resolve(resolved),
                Key.FORGERY_CONFIDENCE.resolve(resolved),
                Key.COPY_MOVE_RATIO.resolve(resolved),
                Key.COPY_MOVE_MIN_DISTANCE.resolve(resolved),
                Key.COPY_MOVE_MIN_MATCHES.resolveInt(resolved),
                Key.COPY_MOVE_MIN_KEYPOINTS.resolveInt(resolved),
                Key.NOISE_INCONSISTENCY.resolve(resolved),
                Key.SPLICING_VARIATION.resolve(resolved),
                Key.AI_GENERATED_THRESHOLD.resolve(resolved),
                Key.AI_SMOOTHNESS_VARIANCE.resolve(resolved),
                Key.AI_TEXTURE_UNIFORMITY.resolve(resolved),
                Key.AI_SENSOR_NOISE.resolve(resolved),
                Key.FREQUENCY_UNIFORM_RATIO.resolve(resolved),
                Key.FREQUENCY_IRREGULAR_RATIO.resolve(resolved),
                Key.METADATA_ANOMALY_WEIGHT.resolve(resolved));
    }

    public ThresholdConfig withForgeryConfidence(double value) {
        return new ThresholdConfig(elaThreshold, elaQuality, elaMinRegionArea, elaMaxDifference, value,
                copyMoveRatio, copyMoveMinDistance, copyMoveMinMatches, copyMoveMinKeypoints, noiseInconsistency,
                splicingVariation, aiGeneratedThreshold, aiSmoothnessVariance, aiTextureUniformity, aiSensorNoise,
                frequencyUniformRatio, frequencyIrregularRatio, metadataAnomalyWeight);
    }

    enum Key {
        ELA_THRESHOLD("ela_threshold", 25, 0, 255, false),
        ELA_QUALITY("ela_quality", 90, 1, 100, true),
        ELA_MIN_REGION_AREA("ela_min_region_area", 100, 0, Double.MAX_VALUE, false),
        ELA_MAX_DIFFERENCE("ela_max_difference", 30, 0, 255, false),
        FORGERY_CONFIDENCE("forgery_confidence", 0.35, 0, 1, false),
        COPY_MOVE_RATIO("copy_move_ratio", 0.7, 0, 1, false),
        COPY_MOVE_MIN_DISTANCE("copy_move_min_distance", 50, 0, Double.MAX_VALUE, false),
        COPY_MOVE_MIN_MATCHES("copy_move_min_matches", 20, 0, Integer.MAX_VALUE, true),
        COPY_MOVE_MIN_KEYPOINTS("copy_move_min_keypoints", 10, 2, Integer.MAX_VALUE, true),
        NOISE_INCONSISTENCY("noise_inconsistency", 0.5, 0, Double.MAX_VALUE, false),
        SPLICING_VARIATION("splicing_variation", 0.3, 0, Double.MAX_VALUE, false),
        AI_GENERATED_THRESHOLD("ai_generated_threshold", 0.5, 0, 1, false),
        AI_SMOOTHNESS_VARIANCE("ai_smoothness_variance", 50, 0, Double.MAX_VALUE, false),
        AI_TEXTURE_UNIFORMITY("ai_texture_uniformity", 0.15, 0, 1, false),
        AI_SENSOR_NOISE("ai_sensor_noise", 5, 0, 255, false),
        FREQUENCY_UNIFORM_RATIO("frequency_uniform_ratio", 0.3, 0, Double.MAX_VALUE, false),
        FREQUENCY_IRREGULAR_RATIO("frequency_irregular_ratio", 1.5, 0, Double.MAX_VALUE, false),
        METADATA_ANOMALY_WEIGHT("metadata_anomaly_weight", 0.3, 0, 1, false);

        private final String id;
        private final double defaultValue;
        private final double min;
        private final double max;
        private final boolean integral;

        Key(String id, double defaultValue, double min, double max, boolean integral) {
            this.id = id;
            this.defaultValue = defaultValue;
            this.min = min;
            this.max = max;
            this.integral = integral;
        }

        static Key of(String name) {
            if (name != null) {
                String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
                for (Key key : values()) {
                    if (key.id.equals(normalized)) {
                        return key;
                    }
                }
            }
            throw new IllegalArgumentException("Unknown threshold key '" + name + "'");
        }

        String id() {
            return id;
        }

        double defaultValue() {
            return defaultValue;
        }

        void check(double value) {
            if (Double.isNaN(value) || value < min || value > max) {
                throw new IllegalArgumentException(String.format(Locale.ROOT,
                        "Threshold '%s' must lie within [%s, %s] but was %s", id, min, max, value));
            }
            if (integral && value != Math.rint(value)) {
                throw new IllegalArgumentException("Threshold '" + id + "' must be an integer but was " + value);
            }
        }

        double resolve(Map<Key, Number> values) {
            Number value = values.get(this);
            double resolved = value == null ? defaultValue : value.doubleValue();
            check(resolved);
            return resolved;
        }

        int resolveInt(Map<Key, Number> values) {
            return (int) resolve(values);
        }
    }
}
