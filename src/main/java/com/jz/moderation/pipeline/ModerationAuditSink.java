package com.jz.moderation.pipeline;

/**
 * 审核结果的外部落点（持久化、消息队列等）。实现方抛出的异常只记日志，不影响结论。
 */
public interface ModerationAuditSink {
    void record(ModerationResult result);
}
