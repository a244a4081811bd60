package com.jz.moderation.signal;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 单次请求的完整信号轨迹，交给外部持久化。
 */
@Value
@Builder
public class SignalTrace {
    DetectionSignal detection;
    /** 校验前的姿态信号 */
    PoseSignal rawPose;
    PoseSignal pose;
    FaceSignal face;
    DescriptionSignal description;
    List<StageReport> stageReports;
    List<String> validationCodes;
}
