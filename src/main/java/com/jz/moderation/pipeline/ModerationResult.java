package com.jz.moderation.pipeline;

import com.jz.moderation.config.ComponentConfig;
import com.jz.moderation.fusion.RiskAssessment;
import com.jz.moderation.policy.ModerationDecision;
import com.jz.moderation.signal.SignalTrace;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ModerationResult {

    public static final String ANALYSIS_VERSION = "image-moderation/1";

    ModerationDecision decision;
    RiskAssessment assessment;
    SignalTrace trace;
    String imageRef;
    String analysisVersion;
    Long modelId;
    Instant timestamp;
    /** 本次请求实际生效的组件开关 */
    ComponentConfig configurationUsed;
    long settingsRevision;
}
