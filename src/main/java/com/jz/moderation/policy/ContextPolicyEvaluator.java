package com.jz.moderation.policy;

import com.jz.moderation.fusion.RiskAssessment;
import com.jz.moderation.signal.DescriptionSignal;
import com.jz.moderation.signal.FaceSignal;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 风险分 + 场景阈值 -> 审核结论。
 * 硬规则（未成年人脸、儿童关键词）先于阈值判断，与分数无关。
 */
@Component
public class ContextPolicyEvaluator {

    public static final double UNDERAGE_CONFIDENCE = 99.0;
    public static final double CHILD_CONTENT_CONFIDENCE = 95.0;
    public static final double REVIEW_CONFIDENCE = 50.0;

    public ModerationDecision evaluate(RiskAssessment assessment,
                                       FaceSignal face,
                                       DescriptionSignal description,
                                       String contextType,
                                       ContextPolicyTable table,
                                       List<String> stageNotes) {
        ContextPolicy policy = table.resolve(contextType);
        List<String> reasoning = new ArrayList<>(assessment.getReasoning());
        if (stageNotes != null) reasoning.addAll(stageNotes);

        ModerationDecision.ModerationDecisionBuilder b = ModerationDecision.builder()
                .contextType(policy.getContextType())
                .requestedContextType(contextType)
                .appliedPolicy(policy)
                .reasoning(List.copyOf(reasoning));

        // 1) 未成年
        if (face != null && face.isUnderageDetected()) {
            return b.status(ModerationStatus.REJECTED)
                    .action(ModerationAction.REJECT_UNDERAGE_CONTENT)
                    .humanReviewRequired(true)
                    .confidence(UNDERAGE_CONFIDENCE)
                    .rejectionReason("Detected face appears under " + face.getMinAgeThreshold()
                            + " years old (min detected age " + face.getMinAge() + ")")
                    .overrideApplied(true)
                    .build();
        }

        // 2) 儿童关键词
        if (description != null && description.isContainsChildKeywords()) {
            return b.status(ModerationStatus.REJECTED)
                    .action(ModerationAction.REJECT_CHILD_CONTENT)
                    .humanReviewRequired(true)
                    .confidence(CHILD_CONTENT_CONFIDENCE)
                    .rejectionReason("Image description mentions children: "
                            + String.join(", ", description.getChildKeywordsFound()))
                    .overrideApplied(true)
                    .build();
        }

        // 3) 阈值
        double score = assessment.getFinalRiskScore();
        if (score <= policy.getAutoApproveThreshold()) {
            return b.status(ModerationStatus.APPROVED)
                    .action(ModerationAction.APPROVE_AUTOMATICALLY)
                    .humanReviewRequired(false)
                    .confidence(Math.round((100 - score) * 100) / 100.0)
                    .build();
        }
        if (score >= policy.getAutoRejectThreshold()) {
            return b.status(ModerationStatus.REJECTED)
                    .action(ModerationAction.REJECT_AUTOMATICALLY)
                    .humanReviewRequired(true)
                    .confidence(score)
                    .build();
        }
        return b.status(ModerationStatus.FLAGGED_FOR_REVIEW)
                .action(ModerationAction.REQUIRE_HUMAN_REVIEW)
                .humanReviewRequired(true)
                .confidence(REVIEW_CONFIDENCE)
                .build();
    }
}
