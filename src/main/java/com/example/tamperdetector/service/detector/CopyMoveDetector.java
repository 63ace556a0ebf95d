package com.example.tamperdetector.service.detector;

import com.example.tamperdetector.config.ThresholdConfig;
import com.example.tamperdetector.model.Finding;
import com.example.tamperdetector.model.Severity;
import com.example.tamperdetector.model.Technique;
import com.example.tamperdetector.util.ImageUtils;
import java.util.Locale;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.DMatch;
import org.bytedeco.opencv.opencv_core.DMatchVector;
import org.bytedeco.opencv.opencv_core.DMatchVectorVector;
import org.bytedeco.opencv.opencv_core.KeyPointVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point2f;
import org.bytedeco.opencv.opencv_features2d.BFMatcher;
import org.bytedeco.opencv.opencv_features2d.SIFT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Copy-move forgery detection through SIFT self-matching. Every descriptor is matched against
 * the whole descriptor set of the same image; a pair survives when it passes the ratio test
 * against the next candidate and the two keypoints lie far enough apart to rule out
 * neighbouring texture.
 */
@Component
public class CopyMoveDetector extends AbstractForensicDetector {

    private static final Logger log = LoggerFactory.getLogger(CopyMoveDetector.class);

    // self match plus the two candidates of the ratio test
    private static final int NEIGHBOURS = 3;

    @Override
    public Technique technique() {
        return Technique.COPY_MOVE;
    }

    @Override
    protected Finding evaluate(DetectionContext context) {
        ThresholdConfig thresholds = context.thresholds();
        Mat gray = ImageUtils.toGrayMat(context.image());
        Mat mask = new Mat();
        Mat descriptors = new Mat();
        KeyPointVector keypoints = new KeyPointVector();
        SIFT sift = SIFT.create();
        try {
            sift.detectAndCompute(gray, mask, keypoints, descriptors);
            long keypointCount = keypoints.size();
            if (descriptors.empty() || keypointCount < thresholds.copyMoveMinKeypoints()) {
                log.debug("Copy-move skipped: only {} keypoints", keypointCount);
                return Finding.clean(technique(), 0.0, String.format(Locale.ROOT,
                        "Insufficient features for copy-move detection (%d keypoints)", keypointCount));
            }

            int pairs = countSuspiciousPairs(keypoints, descriptors, thresholds);
            log.debug("Copy-move found {} distant matches among {} keypoints", pairs, keypointCount);
            if (pairs > thresholds.copyMoveMinMatches()) {
                double score = Math.min(1.0, pairs / 100.0);
                return Finding.triggered(technique(), score, Severity.HIGH, String.format(Locale.ROOT,
                        "Detected %d suspicious feature matches suggesting copy-move forgery", pairs));
            }
            return Finding.clean(technique(), 0.0, String.format(Locale.ROOT,
                    "No copy-move forgery detected (%d distant matches)", pairs));
        } finally {
            sift.close();
            keypoints.close();
            descriptors.close();
            mask.close();
            gray.close();
        }
    }

    private int countSuspiciousPairs(KeyPointVector keypoints, Mat descriptors, ThresholdConfig thresholds) {
        BFMatcher matcher = new BFMatcher(opencv_core.NORM_L2, false);
        DMatchVectorVector matches = new DMatchVectorVector();
        try {
            matcher.knnMatch(descriptors, descriptors, matches, (int) Math.min(NEIGHBOURS, keypoints.size()));
            int pairs = 0;
            for (long i = 0; i < matches.size(); i++) {
                DMatchVector candidates = matches.get(i);
                DMatch best = null;
                DMatch second = null;
                for (long j = 0; j < candidates.size(); j++) {
                    DMatch candidate = candidates.get(j);
                    if (candidate.queryIdx() == candidate.trainIdx()) {
                        continue;
                    }
                    if (best == null) {
                        best = candidate;
                    } else if (second == null) {
                        second = candidate;
                    }
                }
                if (best == null || second == null) {
                    continue;
                }
                if (best.distance() >= thresholds.copyMoveRatio() * second.distance()) {
                    continue;
                }
                Point2f query = keypoints.get(best.queryIdx()).pt();
                Point2f train = keypoints.get(best.trainIdx()).pt();
                double distance = Math.hypot(query.x() - train.x(), query.y() - train.y());
                if (distance > thresholds.copyMoveMinDistance()) {
                    pairs++;
                }
            }
            return pairs;
        } finally {
            matches.close();
            matcher.close();
        }
    }
}
