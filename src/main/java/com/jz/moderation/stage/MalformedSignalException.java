package com.jz.moderation.stage;

import com.jz.moderation.common.ModerationException;

/** 分析器返回了无法归一化的输出，按分析失败处理 */
public class MalformedSignalException extends ModerationException {
    public MalformedSignalException(String message) {
        super(message);
    }
}
