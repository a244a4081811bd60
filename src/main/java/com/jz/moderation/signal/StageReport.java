package com.jz.moderation.signal;

import lombok.Value;

/** 每个阶段一条，用于日志与审计 */
@Value
public class StageReport {
    SignalCategory category;
    StageStatus status;
    long latencyMs;
    String error;

    public static StageReport disabled(SignalCategory category) {
        return new StageReport(category, StageStatus.DISABLED, 0, null);
    }

    /** 例如 face_analysis_timeout；正常和关闭的阶段不出编码 */
    public String degradationCode() {
        return switch (status) {
            case FAILED -> category.code() + "_analysis_error";
            case TIMED_OUT -> category.code() + "_analysis_timeout";
            default -> null;
        };
    }
}
