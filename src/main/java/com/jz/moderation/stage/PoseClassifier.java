package com.jz.moderation.stage;

import com.jz.moderation.analyzer.RawPose;
import com.jz.moderation.signal.PoseCategory;
import com.jz.moderation.signal.PoseMetrics;
import com.jz.moderation.signal.PoseSignal;
import com.jz.moderation.signal.StageStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 几何指标 -> 暗示性分数 -> 类别。类别只由分数分桶决定（0.7 / 0.4 / 0.2）。
 */
@Component
public class PoseClassifier {

    public static final double HIGHLY_SUGGESTIVE = 0.7;
    public static final double MODERATELY_SUGGESTIVE = 0.4;
    public static final double MILDLY_SUGGESTIVE = 0.2;

    static final double TORSO_LEAN_DEGREES = 45;
    static final double HIP_BEND_DEGREES = 60;
    static final double WIDE_LEG_SPREAD = 0.3;

    public PoseSignal classify(RawPose raw) {
        if (raw == null || raw.getPoseDetected() == null) {
            throw new MalformedSignalException("pose output missing poseDetected");
        }
        if (!raw.getPoseDetected()) {
            return PoseSignal.builder()
                    .status(StageStatus.OK)
                    .category(PoseCategory.UNDETECTED)
                    .reasoning(List.of("no_pose_landmarks_found"))
                    .build();
        }

        PoseMetrics m = PoseMetrics.builder()
                .torsoAngle(orNaN(raw.getTorsoAngle()))
                .hipBendAngle(orNaN(raw.getHipBendAngle()))
                .legSpread(orNaN(raw.getLegSpread()))
                .armsRaised(raw.isArmsRaised())
                .leftHandNearBody(raw.isLeftHandNearBody())
                .rightHandNearBody(raw.isRightHandNearBody())
                .bodyOrientation(raw.getBodyOrientation() == null ? "unknown" : raw.getBodyOrientation())
                .build();

        // NaN 参与比较恒为 false，不会加分
        double score = 0;
        List<String> reasoning = new ArrayList<>();
        if (m.getTorsoAngle() > TORSO_LEAN_DEGREES) {
            score += 0.3;
            reasoning.add("significant_torso_lean");
        }
        if (m.getHipBendAngle() < HIP_BEND_DEGREES) {
            score += 0.4;
            reasoning.add("pronounced_hip_bend");
        }
        if (m.getLegSpread() > WIDE_LEG_SPREAD) {
            score += 0.2;
            reasoning.add("wide_leg_stance");
        }
        if (m.isArmsRaised()) {
            score += 0.1;
            reasoning.add("arms_raised");
        }
        if (m.isLeftHandNearBody() || m.isRightHandNearBody()) {
            score += 0.15;
            reasoning.add("hands_near_body");
        }
        if ("facing_away".equals(m.getBodyOrientation())) {
            score += 0.2;
            reasoning.add("facing_away");
        }
        // 消掉浮点累加误差，免得 0.7 落进下一档
        score = Math.min(Math.round(score * 10_000) / 10_000.0, 1.0);
        if (reasoning.isEmpty()) reasoning.add("neutral_pose_detected");

        return PoseSignal.builder()
                .status(StageStatus.OK)
                .poseDetected(true)
                .category(bucket(score))
                .suggestiveScore(score)
                .poseConfidence(clampUnit(raw.getPoseConfidence()))
                .landmarkCount(Math.max(0, raw.getLandmarkCount()))
                .reasoning(List.copyOf(reasoning))
                .rawMetrics(m)
                .build();
    }

    public static PoseCategory bucket(double score) {
        if (score >= HIGHLY_SUGGESTIVE) return PoseCategory.HIGHLY_SUGGESTIVE;
        if (score >= MODERATELY_SUGGESTIVE) return PoseCategory.MODERATELY_SUGGESTIVE;
        if (score >= MILDLY_SUGGESTIVE) return PoseCategory.MILDLY_SUGGESTIVE;
        return PoseCategory.NEUTRAL;
    }

    private static double orNaN(Double v) {
        return v == null ? Double.NaN : v;
    }

    private static double clampUnit(Double v) {
        if (v == null || v.isNaN()) return 0;
        return Math.max(0, Math.min(1, v));
    }
}
