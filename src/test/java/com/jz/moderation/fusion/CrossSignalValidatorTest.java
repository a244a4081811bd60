package com.jz.moderation.fusion;

import com.jz.moderation.signal.PoseCategory;
import com.jz.moderation.signal.PoseMetrics;
import com.jz.moderation.signal.PoseSignal;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.jz.moderation.fusion.SignalFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CrossSignalValidatorTest {

    private final CrossSignalValidator validator = new CrossSignalValidator();

    @Test
    void faceOnlyImage_overridesDetectedPose() {
        PoseMetrics m = metrics(60, 40, 0.2);
        PoseSignal original = pose(PoseCategory.HIGHLY_SUGGESTIVE, 0.7, 0.9, m);

        ValidatedSignals v = validator.validate(detection(Map.of("FACE_FEMALE", 88.0)), original,
                faces(30), plainDescription());

        PoseSignal p = v.getPose();
        assertEquals(PoseCategory.FACE_ONLY_NO_POSE, p.getCategory());
        assertEquals(0.0, p.getSuggestiveScore());
        assertSame(m, p.getRawMetrics());
        assertEquals("face_only_image_no_body_visible", p.getReasoning().get(0));
        assertTrue(p.getReasoning().contains(CrossSignalValidator.FACE_ONLY_OVERRIDE));
        assertTrue(p.getReasoning().contains("original_category:highly_suggestive"));
        assertTrue(p.getReasoning().contains("original_score:0.700"));
        assertTrue(p.getReasoning().contains("raw_metric:torso_angle=60.000"));
        assertSame(original, v.getRawPose());
        assertEquals(List.of(CrossSignalValidator.FACE_ONLY_OVERRIDE), v.getValidationCodes());
    }

    @Test
    void faceOnlyRule_needsExactlyOneFaceLabel() {
        PoseSignal original = pose(PoseCategory.MODERATELY_SUGGESTIVE, 0.4, 0.9, metrics(50, 170, 0.1));

        ValidatedSignals v = validator.validate(
                detection(Map.of("FACE_FEMALE", 88.0, "FEMALE_BREAST_EXPOSED", 40.0)), original,
                faces(30), plainDescription());

        assertSame(original, v.getPose());
        assertTrue(v.getValidationCodes().isEmpty());
    }

    @Test
    void faceOnlyRule_ignoresUndetectedPose() {
        ValidatedSignals v = validator.validate(detection(Map.of("FACE_MALE", 70.0)), noPose(),
                faces(30), plainDescription());
        assertEquals(PoseCategory.UNDETECTED, v.getPose().getCategory());
        assertTrue(v.getValidationCodes().isEmpty());
    }

    @Test
    void implausibleMetrics_markPoseUncertain_keepScore() {
        PoseSignal original = pose(PoseCategory.MODERATELY_SUGGESTIVE, 0.5, 0.9, metrics(Double.NaN, 170, 0.1));

        ValidatedSignals v = validator.validate(nudity(10), original, faces(30), plainDescription());

        assertEquals(PoseCategory.UNCERTAIN_POSE_DETECTION, v.getPose().getCategory());
        assertEquals(0.5, v.getPose().getSuggestiveScore());
        assertTrue(v.getPose().getReasoning().contains(CrossSignalValidator.EXTREME_METRICS_WARNING));
        assertEquals(List.of(CrossSignalValidator.EXTREME_METRICS_WARNING), v.getValidationCodes());
    }

    @Test
    void outOfRangeLegSpread_isImplausible() {
        assertTrue(metrics(10, 170, 1.5).isImplausible());
        assertTrue(metrics(10, 200, 0.2).isImplausible());
        assertTrue(metrics(10, 170, Double.POSITIVE_INFINITY).isImplausible());
        assertFalse(metrics(10, 170, 0.2).isImplausible());
    }

    @Test
    void validatorIsDeterministic() {
        PoseSignal original = pose(PoseCategory.HIGHLY_SUGGESTIVE, 0.7, 0.9, metrics(60, 40, 0.2));
        ValidatedSignals a = validator.validate(detection(Map.of("FACE_FEMALE", 88.0)), original, faces(30), plainDescription());
        ValidatedSignals b = validator.validate(detection(Map.of("FACE_FEMALE", 88.0)), original, faces(30), plainDescription());
        assertEquals(a, b);
    }
}
