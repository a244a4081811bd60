package com.jz.moderation.policy;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 最终审核结论。每个请求只生成一次，之后不再修改。
 */
@Value
@Builder
public class ModerationDecision {
    ModerationStatus status;
    ModerationAction action;
    boolean humanReviewRequired;
    /** 0~100 */
    double confidence;
    /** 实际套用的场景键（未知场景时为默认场景） */
    String contextType;
    String requestedContextType;
    ContextPolicy appliedPolicy;
    /** 命中硬规则时的说明，否则为 null */
    String rejectionReason;
    boolean overrideApplied;
    List<String> reasoning;
}
