package com.example.tamperdetector.service.metadata;

import com.example.tamperdetector.model.AnomalyKind;
import com.example.tamperdetector.model.ImageMetadata;
import com.example.tamperdetector.model.MetadataAnomaly;
import com.example.tamperdetector.model.Severity;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flags metadata conditions that commonly accompany edited or re-exported images. The scorer
 * only inspects the tag map handed over by the extraction collaborator and never touches the
 * image stream itself.
 */
@Component
public class MetadataAnomalyScorer {

    private static final Logger log = LoggerFactory.getLogger(MetadataAnomalyScorer.class);

    static final List<String> EXPECTED_TAGS = List.of(
            ImageMetadata.MAKE,
            ImageMetadata.MODEL,
            ImageMetadata.DATE_TIME,
            ImageMetadata.DATE_TIME_ORIGINAL,
            ImageMetadata.SOFTWARE);

    static final int MAX_MISSING_TAGS = 3;

    static final List<String> EDITING_TOOLS = List.of(
            "photoshop", "gimp", "paint.net", "lightroom", "pixlr", "affinity", "corel");

    public List<MetadataAnomaly> score(ImageMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        List<MetadataAnomaly> anomalies = new ArrayList<>();

        Optional<String> extractionError = metadata.extractionError();
        if (extractionError.isPresent()) {
            anomalies.add(new MetadataAnomaly(AnomalyKind.EXTRACTION_ERROR, Severity.LOW,
                    "Metadata extraction error: " + extractionError.get()));
            log.debug("Metadata extraction failed upstream: {}", extractionError.get());
            return anomalies;
        }

        long missing = EXPECTED_TAGS.stream().filter(tag -> !metadata.has(tag)).count();
        if (missing > MAX_MISSING_TAGS) {
            anomalies.add(new MetadataAnomaly(AnomalyKind.MISSING_METADATA, Severity.MEDIUM,
                    String.format(Locale.ROOT, "Missing %d expected EXIF tags", missing)));
        }

        metadata.software()
                .filter(software -> EDITING_TOOLS.stream().anyMatch(software::contains))
                .ifPresent(software -> anomalies.add(new MetadataAnomaly(AnomalyKind.EDITING_SOFTWARE,
                        Severity.HIGH, "Image edited with: " + software)));

        Optional<String> dateTime = metadata.tag(ImageMetadata.DATE_TIME);
        Optional<String> original = metadata.tag(ImageMetadata.DATE_TIME_ORIGINAL);
        if (dateTime.isPresent() && original.isPresent() && !dateTime.get().equals(original.get())) {
            anomalies.add(new MetadataAnomaly(AnomalyKind.DATE_INCONSISTENCY, Severity.MEDIUM,
                    "DateTime and DateTimeOriginal do not match"));
        }

        if (!metadata.parsable()) {
            anomalies.add(new MetadataAnomaly(AnomalyKind.INVALID_METADATA, Severity.HIGH,
                    "EXIF data is corrupted or invalid"));
        } else if (metadata.allGroupsEmpty()) {
            anomalies.add(new MetadataAnomaly(AnomalyKind.STRIPPED_METADATA, Severity.HIGH,
                    "EXIF data appears to be stripped or missing"));
        }

        log.debug("Metadata scoring produced {} anomalies ({} expected tags missing)", anomalies.size(), missing);
        return List.copyOf(anomalies);
    }
}
