package com.jz.moderation.analyzer;

import lombok.*;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class RawPose {
    private Boolean poseDetected;
    private int landmarkCount;
    private Double poseConfidence;     // 关键点可见度均值 0~1
    private Double torsoAngle;         // 躯干偏离竖直方向的角度，度
    private Double hipBendAngle;       // 髋部躯干与大腿夹角，度（180 = 伸直）
    private Double legSpread;          // 归一化画面宽度
    private boolean armsRaised;
    private boolean leftHandNearBody;
    private boolean rightHandNearBody;
    private String bodyOrientation;    // facing_camera / side_view / facing_away / unknown
}
