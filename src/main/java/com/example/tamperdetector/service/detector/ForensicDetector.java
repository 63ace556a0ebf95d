package com.example.tamperdetector.service.detector;

import com.example.tamperdetector.model.Finding;
import com.example.tamperdetector.model.Technique;

/**
 * A single forensic technique. Implementations are stateless and side-effect free, so one
 * instance may serve concurrent analyses. {@link #analyze(DetectionContext)} always returns a
 * finding: a technique that cannot complete reports a non-triggered, informational finding
 * instead of throwing.
 */
public interface ForensicDetector {

    Technique technique();

    /**
     * @param context image, metadata and threshold snapshot of the running analysis
     * @return exactly one finding for {@link #technique()}
     */
    Finding analyze(DetectionContext context);
}
