package com.jz.moderation.fusion;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 融合后的风险评估。各 contribution 单位为百分点（已乘年龄系数），
 * 相加即未截断的最终分。
 */
@Value
@Builder
public class RiskAssessment {

    public static final double FAIL_CLOSED_SCORE = 95.0;

    /** 0~100 */
    double finalRiskScore;
    RiskLevel riskLevel;
    RiskLevelTable levelTable;
    List<String> reasoning;
    double nudityContribution;
    double descriptionContribution;
    double childContentContribution;
    double poseContribution;
    double ageMultiplier;
    boolean ageEvidencePresent;
    boolean failClosed;

    /** 评估本身出错时按高风险处理 */
    public static RiskAssessment failClosed() {
        return RiskAssessment.builder()
                .finalRiskScore(FAIL_CLOSED_SCORE)
                .riskLevel(RiskLevel.CRITICAL)
                .levelTable(RiskLevelTable.NO_AGE_EVIDENCE)
                .reasoning(List.of("assessment_error"))
                .ageMultiplier(1.0)
                .failClosed(true)
                .build();
    }
}
