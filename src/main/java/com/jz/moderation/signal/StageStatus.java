package com.jz.moderation.signal;

public enum StageStatus {
    OK,
    DISABLED,
    FAILED,
    TIMED_OUT;

    /** FAILED / TIMED_OUT：信号是兜底值，不是分析器的真实输出 */
    public boolean isFallback() {
        return this == FAILED || this == TIMED_OUT;
    }
}
