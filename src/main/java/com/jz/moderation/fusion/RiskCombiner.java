package com.jz.moderation.fusion;

import com.jz.moderation.config.ComponentConfig;
import com.jz.moderation.config.DetectionToggle;
import com.jz.moderation.config.ModerationSettings;
import com.jz.moderation.signal.DescriptionSignal;
import com.jz.moderation.signal.DetectionSignal;
import com.jz.moderation.signal.FaceSignal;
import com.jz.moderation.signal.PoseSignal;
import com.jz.moderation.signal.SignalCategory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 多信号融合：
 * <pre>
 * base  = nudity/100 + 0.1 * 命中风险标签数 + (含儿童关键词 ? 0.5 : 0)
 * mult  = 未成年 ? 3.0 : (年龄可疑 ? 1.5 : 1.0)
 * pose  = suggestiveScore * 0.3 * poseConfidence
 * final = clamp(base * mult * 100 + pose * 100, 0, 100)
 * </pre>
 * 关闭的类别贡献恒为 0。姿态项只做加法，不被年龄系数放大。
 */
@Component
public class RiskCombiner {

    public static final double RISKY_TAG_WEIGHT = 0.1;
    public static final double CHILD_CONTENT_WEIGHT = 0.5;
    public static final double UNDERAGE_MULTIPLIER = 3.0;
    public static final double SUSPICIOUS_AGE_MULTIPLIER = 1.5;
    public static final double POSE_WEIGHT = 0.3;

    public RiskAssessment combine(ValidatedSignals signals, ComponentConfig config, ModerationSettings settings) {
        DetectionSignal detection = signals.getDetection();
        PoseSignal pose = signals.getPose();
        FaceSignal face = signals.getFace();
        DescriptionSignal description = signals.getDescription();
        List<String> reasoning = new ArrayList<>();

        // 裸露
        double nudityRisk = 0;
        if (config.isCategoryEnabled(SignalCategory.NUDITY) && detection != null) {
            nudityRisk = detection.getNudityScore() / 100.0;
            if (detection.getDetectedParts().containsKey(DetectionSignal.ANALYSIS_ERROR_LABEL)) {
                reasoning.add("nudity_analysis_error");
            } else if (detection.isHasNudity()) {
                reasoning.add("nudity_detected_" + pct(detection.getNudityScore()) + "%");
            } else if (detection.getNudityScore() > 0) {
                reasoning.add("low_confidence_nudity_" + pct(detection.getNudityScore()) + "%");
            }
        }

        // 描述标签
        double descriptionRisk = 0;
        if (config.isCategoryEnabled(SignalCategory.DESCRIPTION) && description != null) {
            long risky = description.getTags().stream().filter(settings.getRiskyTags()::contains).count();
            if (risky > 0) {
                descriptionRisk = RISKY_TAG_WEIGHT * risky;
                reasoning.add("risky_content_tags_" + risky);
            }
        }

        // 儿童关键词
        double childRisk = 0;
        if (config.isChildScanEnabled() && description != null && description.isContainsChildKeywords()) {
            childRisk = CHILD_CONTENT_WEIGHT;
            reasoning.add("children_detected_in_description");
        }

        // 年龄系数
        double ageMultiplier = 1.0;
        boolean ageEvidence = false;
        if (config.isCategoryEnabled(SignalCategory.FACE) && face != null) {
            ageEvidence = face.hasAgeEvidence();
            if (face.isUnderageDetected()) {
                ageMultiplier = UNDERAGE_MULTIPLIER;
                reasoning.add("underage_face_detected_min_age_" + face.getMinAge());
            } else if (face.isSuspiciousAge()) {
                ageMultiplier = SUSPICIOUS_AGE_MULTIPLIER;
                reasoning.add("suspicious_age_detected_min_age_" + face.getMinAge());
            }
        }

        // 姿态
        double poseRisk = 0;
        if (config.isCategoryEnabled(SignalCategory.POSE) && pose != null) {
            poseRisk = pose.getSuggestiveScore() * POSE_WEIGHT * pose.getPoseConfidence();
            if (poseRisk > 0) {
                reasoning.add("suggestive_pose_" + pose.getCategory().code());
            }
        }

        if (reasoning.isEmpty()) {
            reasoning.add("clean_content");
        }
        if (!config.disabledToggles().isEmpty()) {
            reasoning.add("components_disabled:" + config.disabledToggles().stream()
                    .map(DetectionToggle::key)
                    .collect(Collectors.joining(",")));
        }

        double score = fuse(nudityRisk, descriptionRisk, childRisk, ageMultiplier, poseRisk);
        RiskLevelTable table = ageEvidence ? RiskLevelTable.AGE_EVIDENCE : RiskLevelTable.NO_AGE_EVIDENCE;

        return RiskAssessment.builder()
                .finalRiskScore(score)
                .riskLevel(table.levelFor(score))
                .levelTable(table)
                .reasoning(List.copyOf(reasoning))
                .nudityContribution(round2(nudityRisk * ageMultiplier * 100))
                .descriptionContribution(round2(descriptionRisk * ageMultiplier * 100))
                .childContentContribution(round2(childRisk * ageMultiplier * 100))
                .poseContribution(round2(poseRisk * 100))
                .ageMultiplier(ageMultiplier)
                .ageEvidencePresent(ageEvidence)
                .build();
    }

    /** 融合公式本体，输入均为 0~1 量纲（系数除外） */
    public static double fuse(double nudityRisk, double descriptionRisk, double childRisk,
                              double ageMultiplier, double poseRisk) {
        double base = nudityRisk + descriptionRisk + childRisk;
        double raw = base * ageMultiplier * 100 + poseRisk * 100;
        if (Double.isNaN(raw)) return 0;
        return Math.max(0, Math.min(100, round2(raw)));
    }

    static double round2(double v) {
        return Math.round(v * 100) / 100.0;
    }

    private static String pct(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }
}
