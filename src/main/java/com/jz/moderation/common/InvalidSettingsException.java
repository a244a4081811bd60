package com.jz.moderation.common;

/** 管理端提交的配置不合法；当前生效的快照保持不变。 */
public class InvalidSettingsException extends ModerationException {
    public InvalidSettingsException(String message) {
        super(message);
    }
}
