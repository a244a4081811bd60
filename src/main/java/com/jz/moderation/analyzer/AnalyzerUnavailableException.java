package com.jz.moderation.analyzer;

import com.jz.moderation.common.ModerationException;
import com.jz.moderation.signal.SignalCategory;

/** 没有注册该类别的分析器，按分析失败处理 */
public class AnalyzerUnavailableException extends ModerationException {
    public AnalyzerUnavailableException(SignalCategory category) {
        super("no analyzer registered for " + category.code());
    }
}
