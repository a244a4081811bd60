package com.jz.moderation.policy;

import lombok.Value;

/** 某个场景的阈值对（分数单位 0~100） */
@Value
public class ContextPolicy {
    String contextType;
    double autoApproveThreshold;
    double autoRejectThreshold;
}
