package com.jz.moderation.fusion;

import com.jz.moderation.signal.DescriptionSignal;
import com.jz.moderation.signal.DetectionSignal;
import com.jz.moderation.signal.FaceSignal;
import com.jz.moderation.signal.PoseCategory;
import com.jz.moderation.signal.PoseSignal;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 信号间的一致性校验。纯函数，不抛异常；规则按顺序，命中第一条即停。
 */
@Component
public class CrossSignalValidator {

    public static final String FACE_ONLY_OVERRIDE =
            "validation_override:pose_detection_disabled_for_face_only_image";
    public static final String EXTREME_METRICS_WARNING =
            "validation_warning:extreme_metrics_detected";

    public ValidatedSignals validate(DetectionSignal detection,
                                     PoseSignal pose,
                                     FaceSignal face,
                                     DescriptionSignal description) {
        PoseSignal validated = pose;
        List<String> codes = new ArrayList<>();

        if (detection.isFaceOnly() && pose.isPoseDetected()) {
            // 1) 只有一张脸却报出了身体姿态：姿态不可信
            validated = faceOnly(pose);
            codes.add(FACE_ONLY_OVERRIDE);
        } else if (pose.isPoseDetected() && pose.getRawMetrics() != null && pose.getRawMetrics().isImplausible()) {
            // 2) 几何指标超出物理范围：分数保留，标记为不确定
            List<String> reasoning = new ArrayList<>(safe(pose.getReasoning()));
            reasoning.add(EXTREME_METRICS_WARNING);
            validated = pose.toBuilder()
                    .category(PoseCategory.UNCERTAIN_POSE_DETECTION)
                    .reasoning(List.copyOf(reasoning))
                    .build();
            codes.add(EXTREME_METRICS_WARNING);
        }

        return ValidatedSignals.builder()
                .detection(detection)
                .pose(validated)
                .rawPose(pose)
                .face(face)
                .description(description)
                .validationCodes(List.copyOf(codes))
                .build();
    }

    private static PoseSignal faceOnly(PoseSignal pose) {
        List<String> reasoning = new ArrayList<>();
        reasoning.add("face_only_image_no_body_visible");
        reasoning.add(FACE_ONLY_OVERRIDE);
        reasoning.add("original_category:" + pose.getCategory().code());
        reasoning.add("original_score:" + String.format(Locale.ROOT, "%.3f", pose.getSuggestiveScore()));
        if (pose.getRawMetrics() != null) {
            reasoning.addAll(pose.getRawMetrics().toReasoningCodes());
        }
        return pose.toBuilder()
                .category(PoseCategory.FACE_ONLY_NO_POSE)
                .suggestiveScore(0)
                .reasoning(List.copyOf(reasoning))
                .build();
    }

    private static List<String> safe(List<String> l) {
        return l == null ? List.of() : l;
    }
}
