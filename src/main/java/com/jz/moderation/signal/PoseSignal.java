package com.jz.moderation.signal;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class PoseSignal {
    StageStatus status;
    boolean poseDetected;
    PoseCategory category;
    /** 0~1 */
    double suggestiveScore;
    /** 关键点可见度均值 0~1，用作姿态项权重 */
    double poseConfidence;
    int landmarkCount;
    List<String> reasoning;
    PoseMetrics rawMetrics;

    public static PoseSignal disabled() {
        return PoseSignal.builder()
                .status(StageStatus.DISABLED)
                .category(PoseCategory.DISABLED)
                .reasoning(List.of("pose_analysis_disabled"))
                .build();
    }

    public static PoseSignal analysisError(StageStatus status) {
        return PoseSignal.builder()
                .status(status)
                .category(PoseCategory.ANALYSIS_ERROR)
                .reasoning(List.of("analysis_error"))
                .build();
    }
}
