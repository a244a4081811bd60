package com.jz.moderation.fusion;

/** 从低到高，ordinal 即严重度 */
public enum RiskLevel {
    MINIMAL,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
