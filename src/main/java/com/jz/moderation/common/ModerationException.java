package com.jz.moderation.common;

/** 审核链路异常的根类型（非受检）。 */
public class ModerationException extends RuntimeException {
    public ModerationException(String message) {
        super(message);
    }

    public ModerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
