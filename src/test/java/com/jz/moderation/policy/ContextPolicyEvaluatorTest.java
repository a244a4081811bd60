package com.jz.moderation.policy;

import com.jz.moderation.fusion.RiskAssessment;
import com.jz.moderation.fusion.RiskLevel;
import com.jz.moderation.fusion.RiskLevelTable;
import com.jz.moderation.signal.DescriptionSignal;
import com.jz.moderation.signal.FaceSignal;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.jz.moderation.fusion.SignalFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ContextPolicyEvaluatorTest {

    private final ContextPolicyEvaluator evaluator = new ContextPolicyEvaluator();
    private final ContextPolicyTable table = ContextPolicyTable.defaults();

    private static RiskAssessment score(double s) {
        return RiskAssessment.builder()
                .finalRiskScore(s)
                .riskLevel(RiskLevelTable.NO_AGE_EVIDENCE.levelFor(s))
                .levelTable(RiskLevelTable.NO_AGE_EVIDENCE)
                .reasoning(List.of("nudity_detected_" + s + "%"))
                .ageMultiplier(1.0)
                .build();
    }

    private ModerationDecision decide(double s, String context) {
        return evaluator.evaluate(score(s), faces(), plainDescription(), context, table, List.of());
    }

    @Test
    void publicGallery_lowScoreIsApproved() {
        ModerationDecision d = decide(15, "public_gallery");
        assertEquals(ModerationStatus.APPROVED, d.getStatus());
        assertEquals(ModerationAction.APPROVE_AUTOMATICALLY, d.getAction());
        assertEquals(85.0, d.getConfidence());
        assertFalse(d.isHumanReviewRequired());
        assertFalse(d.isOverrideApplied());
    }

    @Test
    void publicGallery_midScoreIsFlagged() {
        ModerationDecision d = decide(50, "public_gallery");
        assertEquals(ModerationStatus.FLAGGED_FOR_REVIEW, d.getStatus());
        assertEquals(ModerationAction.REQUIRE_HUMAN_REVIEW, d.getAction());
        assertEquals(50.0, d.getConfidence());
        assertTrue(d.isHumanReviewRequired());
    }

    @Test
    void thresholdsAreInclusive() {
        assertEquals(ModerationStatus.APPROVED, decide(20, "public_gallery").getStatus());
        ModerationDecision rejected = decide(80, "public_gallery");
        assertEquals(ModerationStatus.REJECTED, rejected.getStatus());
        assertEquals(ModerationAction.REJECT_AUTOMATICALLY, rejected.getAction());
        assertEquals(80.0, rejected.getConfidence());
        assertTrue(rejected.isHumanReviewRequired());
    }

    @Test
    void contextChangesOutcomeForSameScore() {
        assertEquals(ModerationStatus.APPROVED, decide(55, "private_gallery").getStatus());
        assertEquals(ModerationStatus.APPROVED, decide(55, "paysite_content").getStatus());
        assertEquals(ModerationStatus.FLAGGED_FOR_REVIEW, decide(55, "public_gallery").getStatus());
        assertEquals(ModerationStatus.FLAGGED_FOR_REVIEW, decide(75, "paysite_content").getStatus());
        assertEquals(ModerationStatus.APPROVED, decide(75, "private_gallery").getStatus());
        assertEquals(ModerationStatus.REJECTED, decide(80, "profile_pic").getStatus());
        assertEquals(ModerationStatus.REJECTED, decide(80, "no_such_context").getStatus());
    }

    @Test
    void unknownContext_usesDefaultPolicy() {
        ModerationDecision d = decide(50, "dating_app");
        assertEquals("public_gallery", d.getContextType());
        assertEquals("dating_app", d.getRequestedContextType());
        assertEquals(ModerationStatus.FLAGGED_FOR_REVIEW, d.getStatus());

        assertEquals("public_gallery", decide(10, null).getContextType());
        assertEquals("public_gallery", decide(10, "  ").getContextType());
    }

    @Test
    void underageFace_rejectsEvenAtZero() {
        FaceSignal kid = faces(34, 12);
        for (String context : List.of("public_gallery", "private_gallery", "paysite_content")) {
            ModerationDecision d = evaluator.evaluate(score(0), kid, plainDescription(), context, table, List.of());
            assertEquals(ModerationStatus.REJECTED, d.getStatus());
            assertEquals(ModerationAction.REJECT_UNDERAGE_CONTENT, d.getAction());
            assertEquals(99.0, d.getConfidence());
            assertTrue(d.isHumanReviewRequired());
            assertTrue(d.isOverrideApplied());
            assertTrue(d.getRejectionReason().contains("under 16"));
            assertTrue(d.getRejectionReason().contains("12"));
        }
    }

    @Test
    void childKeywords_rejectEvenAtZero() {
        DescriptionSignal desc = description("a boy on a beach", Set.of("beach"), List.of("boy"));
        ModerationDecision d = evaluator.evaluate(score(0), faces(), desc, "private_gallery", table, List.of());
        assertEquals(ModerationStatus.REJECTED, d.getStatus());
        assertEquals(ModerationAction.REJECT_CHILD_CONTENT, d.getAction());
        assertEquals(95.0, d.getConfidence());
        assertTrue(d.getRejectionReason().contains("boy"));
    }

    @Test
    void underageTakesPrecedenceOverChildKeywords() {
        DescriptionSignal desc = description("a girl", Set.of(), List.of("girl"));
        ModerationDecision d = evaluator.evaluate(score(0), faces(9), desc, "public_gallery", table, List.of());
        assertEquals(ModerationAction.REJECT_UNDERAGE_CONTENT, d.getAction());
    }

    @Test
    void failClosedAssessment_isNeverApproved() {
        for (String context : table.getPolicies().keySet()) {
            ModerationDecision d = evaluator.evaluate(RiskAssessment.failClosed(), faces(), plainDescription(),
                    context, table, List.of());
            assertNotEquals(ModerationStatus.APPROVED, d.getStatus(), context);
        }
        assertEquals(RiskLevel.CRITICAL, RiskAssessment.failClosed().getRiskLevel());
    }

    @Test
    void stageNotesAreAppendedToReasoning() {
        ModerationDecision d = evaluator.evaluate(score(10), faces(), plainDescription(), "public_gallery", table,
                List.of("pose_analysis_error", "face_analysis_timeout"));
        assertEquals(List.of("nudity_detected_10.0%", "pose_analysis_error", "face_analysis_timeout"), d.getReasoning());
    }
}
