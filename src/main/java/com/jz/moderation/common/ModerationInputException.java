package com.jz.moderation.common;

/**
 * 请求级错误：调用方必须把它当作“没有结论”，而不是“内容安全”。
 * 分析器自身的失败不会走到这里，都在阶段内部兜底了。
 */
public class ModerationInputException extends ModerationException {
    public ModerationInputException(String message) {
        super(message);
    }

    public ModerationInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
