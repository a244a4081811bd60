package com.jz.moderation.stage;

import com.jz.moderation.common.ModerationException;
import com.jz.moderation.signal.SignalCategory;

/** 分析器任务在线程池里排队过久，一直没开始执行 */
public class StageNotStartedException extends ModerationException {
    public StageNotStartedException(SignalCategory category, long queueTimeoutMs) {
        super(category.code() + " analyzer not started within " + queueTimeoutMs + "ms, executor saturated");
    }
}
