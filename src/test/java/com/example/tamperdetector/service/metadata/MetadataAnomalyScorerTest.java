package com.example.tamperdetector.service.metadata;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.tamperdetector.TestImages;
import com.example.tamperdetector.model.AnomalyKind;
import com.example.tamperdetector.model.ImageMetadata;
import com.example.tamperdetector.model.MetadataAnomaly;
import com.example.tamperdetector.model.Severity;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetadataAnomalyScorerTest {

    private final MetadataAnomalyScorer scorer = new MetadataAnomalyScorer();

    @Test
    void completeCameraMetadataIsClean() {
        assertThat(scorer.score(TestImages.cameraMetadata())).isEmpty();
    }

    @Test
    void strippedMetadataIsMissingAndStripped() {
        List<MetadataAnomaly> anomalies = scorer.score(ImageMetadata.empty());

        assertThat(anomalies).extracting(MetadataAnomaly::kind)
                .containsExactly(AnomalyKind.MISSING_METADATA, AnomalyKind.STRIPPED_METADATA);
        assertThat(anomalies.get(0).description()).isEqualTo("Missing 5 expected EXIF tags");
        assertThat(anomalies.get(1).severity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void exactlyThreeMissingTagsAreTolerated() {
        ImageMetadata metadata = ImageMetadata.builder()
                .tag(ImageMetadata.MAKE, "Sony")
                .tag(ImageMetadata.MODEL, "ILCE-7M3")
                .build();

        assertThat(scorer.score(metadata)).isEmpty();
    }

    @Test
    void editingSoftwareIsFlaggedOnce() {
        ImageMetadata metadata = ImageMetadata.builder()
                .tag(ImageMetadata.MAKE, "Canon")
                .tag(ImageMetadata.MODEL, "EOS R5")
                .tag(ImageMetadata.SOFTWARE, "Adobe Photoshop Lightroom Classic 12.0")
                .build();

        List<MetadataAnomaly> anomalies = scorer.score(metadata);

        assertThat(anomalies).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.kind()).isEqualTo(AnomalyKind.EDITING_SOFTWARE);
            assertThat(anomaly.severity()).isEqualTo(Severity.HIGH);
            assertThat(anomaly.description()).contains("adobe photoshop lightroom");
        });
    }

    @Test
    void mismatchedDatesAreInconsistent() {
        ImageMetadata metadata = ImageMetadata.builder()
                .tag(ImageMetadata.MAKE, "Canon")
                .tag(ImageMetadata.DATE_TIME, "2024:01:02 08:00:00")
                .tag(ImageMetadata.DATE_TIME_ORIGINAL, "2023:12:24 19:45:10")
                .build();

        assertThat(scorer.score(metadata)).extracting(MetadataAnomaly::kind)
                .containsExactly(AnomalyKind.DATE_INCONSISTENCY);
    }

    @Test
    void unparsableBlockIsInvalidNotStripped() {
        assertThat(scorer.score(ImageMetadata.unparsable())).extracting(MetadataAnomaly::kind)
                .containsExactly(AnomalyKind.MISSING_METADATA, AnomalyKind.INVALID_METADATA);
    }

    @Test
    void extractionFailureIsReportedAlone() {
        List<MetadataAnomaly> anomalies = scorer.score(ImageMetadata.extractionFailed("unexpected EOF"));

        assertThat(anomalies).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.kind()).isEqualTo(AnomalyKind.EXTRACTION_ERROR);
            assertThat(anomaly.severity()).isEqualTo(Severity.LOW);
            assertThat(anomaly.description()).endsWith("unexpected EOF");
        });
    }
}
