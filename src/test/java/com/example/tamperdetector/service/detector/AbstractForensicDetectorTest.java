package com.example.tamperdetector.service.detector;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.tamperdetector.TestImages;
import com.example.tamperdetector.model.Finding;
import com.example.tamperdetector.model.Severity;
import com.example.tamperdetector.model.Technique;
import org.junit.jupiter.api.Test;

class AbstractForensicDetectorTest {

    @Test
    void detectorExceptionBecomesFailedFinding() {
        AbstractForensicDetector detector = new StubDetector(() -> {
            throw new DetectorException("zero-sized region");
        });

        Finding finding = detector.analyze(DetectionContext.of(TestImages.flat(8, 8, 0)));

        assertThat(finding.severity()).isEqualTo(Severity.INFO);
        assertThat(finding.triggered()).isFalse();
        assertThat(finding.description()).isEqualTo("Splicing Detection failed: zero-sized region");
    }

    @Test
    void runtimeFailureIsContainedToo() {
        AbstractForensicDetector detector = new StubDetector(() -> {
            throw new IllegalStateException("native assertion");
        });

        Finding finding = detector.analyze(DetectionContext.of(TestImages.flat(8, 8, 0)));

        assertThat(finding.score()).isZero();
        assertThat(finding.description()).isEqualTo("Splicing Detection error: native assertion");
    }

    @FunctionalInterface
    private interface Evaluation {
        Finding run() throws DetectorException;
    }

    private static final class StubDetector extends AbstractForensicDetector {

        private final Evaluation evaluation;

        private StubDetector(Evaluation evaluation) {
            this.evaluation = evaluation;
        }

        @Override
        public Technique technique() {
            return Technique.SPLICING;
        }

        @Override
        protected Finding evaluate(DetectionContext context) throws DetectorException {
            return evaluation.run();
        }
    }
}
