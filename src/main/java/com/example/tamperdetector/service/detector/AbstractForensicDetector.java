package com.example.tamperdetector.service.detector;

import com.example.tamperdetector.model.Finding;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Contains detector failures at the detector boundary. Subclasses report failures through
 * {@link DetectorException}; the native OpenCV layer reports them as {@link RuntimeException}.
 * Both are turned into {@link Finding#failed} so the analysis carries on.
 */
public abstract class AbstractForensicDetector implements ForensicDetector {

    private static final Logger log = LoggerFactory.getLogger(AbstractForensicDetector.class);

    @Override
    public final Finding analyze(DetectionContext context) {
        Objects.requireNonNull(context, "context");
        try {
            return evaluate(context);
        } catch (DetectorException ex) {
            log.warn("{} could not complete: {}", technique().displayName(), ex.getMessage());
            return Finding.failed(technique(), technique().displayName() + " failed: " + ex.getMessage());
        } catch (RuntimeException ex) {
            // cv::Exception is surfaced by JavaCPP as a RuntimeException
            log.warn("{} aborted on {}", technique().displayName(), context.image(), ex);
            return Finding.failed(technique(), technique().displayName() + " error: " + ex.getMessage());
        }
    }

    protected abstract Finding evaluate(DetectionContext context) throws DetectorException;
}
