package com.jz.moderation.fusion;

import com.jz.moderation.signal.DescriptionSignal;
import com.jz.moderation.signal.DetectionSignal;
import com.jz.moderation.signal.FaceSignal;
import com.jz.moderation.signal.PoseSignal;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 交叉校验之后的信号。pose 可能已被替换，rawPose 保留分析器原样结果。
 */
@Value
@Builder
public class ValidatedSignals {
    DetectionSignal detection;
    PoseSignal pose;
    PoseSignal rawPose;
    FaceSignal face;
    DescriptionSignal description;
    List<String> validationCodes;
}
