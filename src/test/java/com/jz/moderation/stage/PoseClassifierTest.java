package com.jz.moderation.stage;

import com.jz.moderation.analyzer.RawPose;
import com.jz.moderation.signal.PoseCategory;
import com.jz.moderation.signal.PoseSignal;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PoseClassifierTest {

    private final PoseClassifier classifier = new PoseClassifier();

    private static RawPose.RawPoseBuilder standing() {
        return RawPose.builder()
                .poseDetected(true)
                .landmarkCount(33)
                .poseConfidence(0.9)
                .torsoAngle(5.0)
                .hipBendAngle(175.0)
                .legSpread(0.1)
                .bodyOrientation("facing_camera");
    }

    @Test
    void standingUpright_isNeutral() {
        PoseSignal s = classifier.classify(standing().build());
        assertEquals(PoseCategory.NEUTRAL, s.getCategory());
        assertEquals(0.0, s.getSuggestiveScore());
        assertEquals(List.of("neutral_pose_detected"), s.getReasoning());
        assertNotNull(s.getRawMetrics());
    }

    @Test
    void factorsAccumulate_andBucketByScore() {
        PoseSignal s = classifier.classify(standing()
                .torsoAngle(60.0)
                .hipBendAngle(40.0)
                .build());
        assertEquals(0.7, s.getSuggestiveScore(), 1e-9);
        assertEquals(PoseCategory.HIGHLY_SUGGESTIVE, s.getCategory());
        assertEquals(List.of("significant_torso_lean", "pronounced_hip_bend"), s.getReasoning());
    }

    @Test
    void scoreIsCappedAtOne() {
        PoseSignal s = classifier.classify(standing()
                .torsoAngle(80.0)
                .hipBendAngle(30.0)
                .legSpread(0.5)
                .armsRaised(true)
                .leftHandNearBody(true)
                .bodyOrientation("facing_away")
                .build());
        assertEquals(1.0, s.getSuggestiveScore());
        assertEquals(6, s.getReasoning().size());
    }

    @Test
    void buckets() {
        assertEquals(PoseCategory.NEUTRAL, PoseClassifier.bucket(0.19));
        assertEquals(PoseCategory.MILDLY_SUGGESTIVE, PoseClassifier.bucket(0.2));
        assertEquals(PoseCategory.MODERATELY_SUGGESTIVE, PoseClassifier.bucket(0.4));
        assertEquals(PoseCategory.HIGHLY_SUGGESTIVE, PoseClassifier.bucket(0.7));
    }

    @Test
    void missingMetrics_neverFire() {
        PoseSignal s = classifier.classify(RawPose.builder().poseDetected(true).build());
        assertEquals(PoseCategory.NEUTRAL, s.getCategory());
        assertTrue(Double.isNaN(s.getRawMetrics().getTorsoAngle()));
        assertEquals(0.0, s.getPoseConfidence());
    }

    @Test
    void noLandmarks_isUndetected() {
        PoseSignal s = classifier.classify(RawPose.builder().poseDetected(false).build());
        assertEquals(PoseCategory.UNDETECTED, s.getCategory());
        assertFalse(s.isPoseDetected());
        assertEquals(List.of("no_pose_landmarks_found"), s.getReasoning());
    }

    @Test
    void nullPayload_isMalformed() {
        assertThrows(MalformedSignalException.class, () -> classifier.classify(null));
        assertThrows(MalformedSignalException.class, () -> classifier.classify(new RawPose()));
    }
}
