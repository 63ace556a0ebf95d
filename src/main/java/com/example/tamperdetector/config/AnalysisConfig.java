package com.example.tamperdetector.config;

import com.example.tamperdetector.model.Technique;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable per-technique enable flags. Every technique is enabled unless switched off.
 */
public record AnalysisConfig(Set<Technique> enabledTechniques) {

    private static final Map<String, Technique> FLAGS = Map.of(
            "enable_ela", Technique.ERROR_LEVEL_ANALYSIS,
            "enable_metadata", Technique.METADATA_ANALYSIS,
            "enable_copy_move", Technique.COPY_MOVE,
            "enable_noise_analysis", Technique.NOISE_PATTERN,
            "enable_double_jpeg", Technique.DOUBLE_COMPRESSION,
            "enable_splicing", Technique.SPLICING,
            "enable_ai_detection", Technique.AI_GENERATED,
            "enable_frequency", Technique.FREQUENCY_DOMAIN);

    public AnalysisConfig {
        Objects.requireNonNull(enabledTechniques, "enabledTechniques");
        enabledTechniques = enabledTechniques.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Technique.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(enabledTechniques));
    }

    public static AnalysisConfig allEnabled() {
        return new AnalysisConfig(EnumSet.allOf(Technique.class));
    }

    public static AnalysisConfig only(Technique first, Technique... rest) {
        return new AnalysisConfig(EnumSet.of(first, rest));
    }

    /**
     * Resolves flags such as {@code enable_ela}. Absent flags stay enabled.
     *
     * @throws IllegalArgumentException for unknown flags or null values
     */
    public static AnalysisConfig fromMap(Map<String, Boolean> flags) {
        Objects.requireNonNull(flags, "flags");
        Set<Technique> enabled = EnumSet.allOf(Technique.class);
        flags.forEach((name, value) -> {
            String normalized = name == null ? null : name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            Technique technique = normalized == null ? null : FLAGS.get(normalized);
            if (technique == null) {
                throw new IllegalArgumentException("Unknown technique flag '" + name + "'");
            }
            if (value == null) {
                throw new IllegalArgumentException("Technique flag '" + name + "' must not be null");
            }
            if (!value) {
                enabled.remove(technique);
            }
        });
        return new AnalysisConfig(enabled);
    }

    public boolean isEnabled(Technique technique) {
        return enabledTechniques.contains(technique);
    }

    public AnalysisConfig without(Technique technique) {
        Set<Technique> remaining = enabledTechniques.isEmpty()
                ? EnumSet.noneOf(Technique.class)
                : EnumSet.copyOf(enabledTechniques);
        remaining.remove(technique);
        return new AnalysisConfig(remaining);
    }
}
