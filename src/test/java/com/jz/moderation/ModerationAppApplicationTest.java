package com.jz.moderation;

import com.jz.moderation.config.ModerationSettingsHolder;
import com.jz.moderation.fusion.RiskLevel;
import com.jz.moderation.pipeline.ModerationPipeline;
import com.jz.moderation.pipeline.ModerationRequest;
import com.jz.moderation.pipeline.ModerationResult;
import com.jz.moderation.policy.ModerationStatus;
import com.jz.moderation.signal.StageStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 不注册任何分析器时整条链路照样跑通，并且按最坏情况拒绝。
 */
@SpringBootTest
class ModerationAppApplicationTest {

    @Autowired
    private ModerationPipeline pipeline;

    @Autowired
    private ModerationSettingsHolder settingsHolder;

    @TempDir
    Path tmp;

    @Test
    void loadsPoliciesFromApplicationYml() {
        var table = settingsHolder.current().getPolicies();
        assertEquals("public_gallery", table.getDefaultContext());
        assertEquals(60, table.resolve("private_gallery").getAutoApproveThreshold());
        assertEquals(70, table.resolve("paysite_content").getAutoApproveThreshold());
        assertEquals(80, table.resolve("profile_pic").getAutoRejectThreshold());
        assertTrue(settingsHolder.current().getChildKeywords().contains("toddler"));
    }

    @Test
    void withoutAnalyzers_failsClosed() throws Exception {
        File png = tmp.resolve("blank.png").toFile();
        ImageIO.write(new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB), "png", png);

        ModerationResult r = pipeline.evaluate(ModerationRequest.builder()
                .imageRef(png.getAbsolutePath())
                .contextType("public_gallery")
                .modelId(1L)
                .build());

        assertEquals(StageStatus.FAILED, r.getTrace().getDetection().getStatus());
        assertEquals(95.0, r.getAssessment().getFinalRiskScore());
        assertEquals(RiskLevel.CRITICAL, r.getAssessment().getRiskLevel());
        assertEquals(ModerationStatus.REJECTED, r.getDecision().getStatus());
        assertTrue(r.getDecision().getReasoning().contains("face_analysis_error"));
    }
}
