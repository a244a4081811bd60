package com.jz.moderation.fusion;

/**
 * 分数到风险等级的分段表。有年龄证据时 CRITICAL 的门槛更高，
 * 因为未成年放大系数已经把分数推高了。
 */
public enum RiskLevelTable {

    AGE_EVIDENCE(90, 70, 40, 20),
    NO_AGE_EVIDENCE(80, 60, 40, 20);

    private final double critical;
    private final double high;
    private final double medium;
    private final double low;

    RiskLevelTable(double critical, double high, double medium, double low) {
        this.critical = critical;
        this.high = high;
        this.medium = medium;
        this.low = low;
    }

    public RiskLevel levelFor(double score) {
        if (score >= critical) return RiskLevel.CRITICAL;
        if (score >= high) return RiskLevel.HIGH;
        if (score >= medium) return RiskLevel.MEDIUM;
        if (score >= low) return RiskLevel.LOW;
        return RiskLevel.MINIMAL;
    }
}
