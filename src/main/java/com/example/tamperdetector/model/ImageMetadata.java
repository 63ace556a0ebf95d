package com.example.tamperdetector.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Normalized metadata tag map handed over by the metadata extraction collaborator. Tags are
 * grouped by directory ({@code Image}, {@code EXIF}, {@code GPS}, ...) and addressed as
 * {@code "<group> <tag>"}, e.g. {@code "Image Make"} or {@code "EXIF DateTimeOriginal"}.
 */
public final class ImageMetadata {

    public static final String GROUP_IMAGE = "Image";
    public static final String GROUP_EXIF = "EXIF";
    public static final String GROUP_GPS = "GPS";

    public static final String MAKE = GROUP_IMAGE + " Make";
    public static final String MODEL = GROUP_IMAGE + " Model";
    public static final String DATE_TIME = GROUP_IMAGE + " DateTime";
    public static final String DATE_TIME_ORIGINAL = GROUP_EXIF + " DateTimeOriginal";
    public static final String SOFTWARE = GROUP_IMAGE + " Software";

    private static final ImageMetadata EMPTY = new ImageMetadata(Map.of(), true, null);

    private final Map<String, Map<String, String>> groups;
    private final boolean parsable;
    private final String extractionError;

    private ImageMetadata(Map<String, Map<String, String>> groups, boolean parsable, String extractionError) {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        groups.forEach((group, tags) -> copy.put(group, Collections.unmodifiableMap(new LinkedHashMap<>(tags))));
        this.groups = Collections.unmodifiableMap(copy);
        this.parsable = parsable;
        this.extractionError = extractionError;
    }

    /**
     * Metadata with a parsable but completely empty tag block, as left behind by stripping tools.
     */
    public static ImageMetadata empty() {
        return EMPTY;
    }

    /**
     * The tag block exists but could not be parsed.
     */
    public static ImageMetadata unparsable() {
        return new ImageMetadata(Map.of(), false, null);
    }

    /**
     * The extractor itself failed; nothing is known about the tags.
     */
    public static ImageMetadata extractionFailed(String reason) {
        return new ImageMetadata(Map.of(), true, reason == null ? "unknown error" : reason);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> tag(String qualifiedName) {
        int separator = qualifiedName.indexOf(' ');
        if (separator <= 0) {
            return Optional.empty();
        }
        Map<String, String> tags = groups.get(qualifiedName.substring(0, separator));
        if (tags == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tags.get(qualifiedName.substring(separator + 1)))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    public boolean has(String qualifiedName) {
        return tag(qualifiedName).isPresent();
    }

    /**
     * Lower-cased software tag, if present.
     */
    public Optional<String> software() {
        return tag(SOFTWARE).map(value -> value.toLowerCase(Locale.ROOT));
    }

    public boolean allGroupsEmpty() {
        return groups.values().stream().allMatch(Map::isEmpty);
    }

    public boolean parsable() {
        return parsable;
    }

    public Optional<String> extractionError() {
        return Optional.ofNullable(extractionError);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ImageMetadata that)) {
            return false;
        }
        return parsable == that.parsable
                && groups.equals(that.groups)
                && java.util.Objects.equals(extractionError, that.extractionError);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(groups, parsable, extractionError);
    }

    @Override
    public String toString() {
        return "ImageMetadata[groups=" + groups + ", parsable=" + parsable
                + (extractionError == null ? "" : ", extractionError=" + extractionError) + "]";
    }

    public static final class Builder {

        private final Map<String, Map<String, String>> groups = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a group even when it ends up holding no tags.
         */
        public Builder group(String group) {
            groups.computeIfAbsent(group, key -> new LinkedHashMap<>());
            return this;
        }

        public Builder tag(String group, String name, String value) {
            groups.computeIfAbsent(group, key -> new LinkedHashMap<>()).put(name, value);
            return this;
        }

        public Builder tag(String qualifiedName, String value) {
            int separator = qualifiedName.indexOf(' ');
            if (separator <= 0) {
                throw new IllegalArgumentException("Tag name must be qualified with its group: " + qualifiedName);
            }
            return tag(qualifiedName.substring(0, separator), qualifiedName.substring(separator + 1), value);
        }

        public ImageMetadata build() {
            return new ImageMetadata(groups, true, null);
        }
    }
}
