package com.jz.moderation.signal;

/** 外部分析器类别（闭集）。 */
public enum SignalCategory {
    NUDITY,
    POSE,
    FACE,
    DESCRIPTION;

    public String code() {
        return name().toLowerCase();
    }
}
