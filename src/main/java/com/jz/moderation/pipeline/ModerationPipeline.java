package com.jz.moderation.pipeline;

import com.jz.moderation.analyzer.ImageInfo;
import com.jz.moderation.analyzer.ImageProbe;
import com.jz.moderation.analyzer.ImageReference;
import com.jz.moderation.common.InvalidModerationRequestException;
import com.jz.moderation.config.ComponentConfig;
import com.jz.moderation.config.ModerationSettings;
import com.jz.moderation.config.ModerationSettingsHolder;
import com.jz.moderation.fusion.CrossSignalValidator;
import com.jz.moderation.fusion.RiskAssessment;
import com.jz.moderation.fusion.RiskCombiner;
import com.jz.moderation.fusion.ValidatedSignals;
import com.jz.moderation.policy.ContextPolicyEvaluator;
import com.jz.moderation.policy.ModerationDecision;
import com.jz.moderation.signal.SignalTrace;
import com.jz.moderation.signal.StageReport;
import com.jz.moderation.stage.StageResults;
import com.jz.moderation.stage.StageRunner;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 单张图片的审核流程：
 * 入参校验 -> 探测图片 -> 取配置快照 -> 各分析阶段 -> 交叉校验 -> 风险融合 -> 场景决策 -> 审计。
 * 分析器故障在阶段内兜底，不会抛到这里；只有入参错误会抛 ModerationInputException。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModerationPipeline {

    private final ImageProbe imageProbe;
    private final ModerationSettingsHolder settingsHolder;
    private final StageRunner stageRunner;
    private final CrossSignalValidator validator;
    private final RiskCombiner combiner;
    private final ContextPolicyEvaluator evaluator;
    private final ModerationAuditSink auditSink;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ModerationResult evaluate(ModerationRequest request) {
        // 0) 入参
        validate(request);
        ImageReference image = ImageReference.of(request.getImageRef().trim());
        ImageInfo info = imageProbe.probe(image);

        // 1) 快照只取一次
        ModerationSettings settings = settingsHolder.current();
        ComponentConfig config = settings.getDefaultComponents().overlay(request.getComponentConfig());
        log.debug("Moderation start image={} context={} revision={} width={} height={} config={}",
                image.getLocation(), request.getContextType(), settings.getRevision(),
                info.getWidth(), info.getHeight(), config);

        // 2) 分析阶段
        StageResults stages = stageRunner.run(image, config, settings);

        // 3) 交叉校验
        ValidatedSignals validated = validator.validate(
                stages.getDetection(), stages.getPose(), stages.getFace(), stages.getDescription());

        // 4) 融合；这里出错按高风险兜底
        RiskAssessment assessment;
        try {
            assessment = combiner.combine(validated, config, settings);
        } catch (RuntimeException e) {
            log.error("Risk assessment failed, failing closed. image={}, err={}", image.getLocation(), e.toString(), e);
            assessment = RiskAssessment.failClosed();
        }

        // 5) 决策
        List<String> stageNotes = stages.getReports().stream()
                .map(StageReport::degradationCode)
                .filter(Objects::nonNull)
                .toList();
        ModerationDecision decision = evaluator.evaluate(assessment, validated.getFace(), validated.getDescription(),
                request.getContextType(), settings.getPolicies(), stageNotes);

        ModerationResult result = ModerationResult.builder()
                .decision(decision)
                .assessment(assessment)
                .trace(SignalTrace.builder()
                        .detection(validated.getDetection())
                        .rawPose(validated.getRawPose())
                        .pose(validated.getPose())
                        .face(validated.getFace())
                        .description(validated.getDescription())
                        .stageReports(stages.getReports())
                        .validationCodes(validated.getValidationCodes())
                        .build())
                .imageRef(image.getLocation())
                .analysisVersion(ModerationResult.ANALYSIS_VERSION)
                .modelId(request.getModelId())
                .timestamp(Instant.now(clock))
                .configurationUsed(config)
                .settingsRevision(settings.getRevision())
                .build();

        Counter.builder("moderation.decision.count")
                .description("Moderation decisions by status")
                .tag("status", decision.getStatus().name().toLowerCase())
                .tag("context", decision.getContextType())
                .register(meterRegistry)
                .increment();
        log.info("Moderation done image={} status={} action={} score={} level={} context={}",
                image.getLocation(), decision.getStatus(), decision.getAction(),
                assessment.getFinalRiskScore(), assessment.getRiskLevel(), decision.getContextType());

        // 6) 审计失败不影响结论
        try {
            auditSink.record(result);
        } catch (RuntimeException e) {
            log.warn("Audit sink failed, image={}, err={}", image.getLocation(), e.toString());
        }
        return result;
    }

    private static void validate(ModerationRequest request) {
        if (request == null) {
            throw new InvalidModerationRequestException("request is required");
        }
        if (request.getImageRef() == null || request.getImageRef().isBlank()) {
            throw new InvalidModerationRequestException("imageRef is required");
        }
        if (request.getModelId() == null || request.getModelId() <= 0) {
            throw new InvalidModerationRequestException("modelId must be a positive integer, got " + request.getModelId());
        }
    }
}
