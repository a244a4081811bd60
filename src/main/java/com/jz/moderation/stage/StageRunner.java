package com.jz.moderation.stage;

import com.jz.moderation.analyzer.AnalyzerUnavailableException;
import com.jz.moderation.analyzer.CaptionAnalyzer;
import com.jz.moderation.analyzer.FaceAnalyzer;
import com.jz.moderation.analyzer.ImageReference;
import com.jz.moderation.analyzer.NudityAnalyzer;
import com.jz.moderation.analyzer.PoseAnalyzer;
import com.jz.moderation.config.ComponentConfig;
import com.jz.moderation.config.ModerationSettings;
import com.jz.moderation.signal.DescriptionSignal;
import com.jz.moderation.signal.DetectionSignal;
import com.jz.moderation.signal.FaceSignal;
import com.jz.moderation.signal.PoseSignal;
import com.jz.moderation.signal.SignalCategory;
import com.jz.moderation.signal.StageReport;
import com.jz.moderation.signal.StageStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * 逐类别调用外部分析器：
 * - 裸露检测先跑完（交叉校验依赖它）；
 * - 姿态 / 人脸 / 描述三者互不依赖，并发派发后在此汇合；
 * - 每次调用有超时（从开始执行起算），超时、排队过久、异常、输出不合法都按类别兜底，不重试，不向上抛。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StageRunner {

    private static final int QUEUED = 0;
    private static final int STARTED = 1;
    private static final int ABANDONED = 2;

    private final Optional<NudityAnalyzer> nudityAnalyzer;
    private final Optional<PoseAnalyzer> poseAnalyzer;
    private final Optional<FaceAnalyzer> faceAnalyzer;
    private final Optional<CaptionAnalyzer> captionAnalyzer;
    private final SignalNormalizer normalizer;
    @Qualifier("analyzerExecutor")
    private final Executor executor;
    private final MeterRegistry meterRegistry;

    public StageResults run(ImageReference image, ComponentConfig config, ModerationSettings settings) {
        long timeoutMs = settings.getStageTimeout().toMillis();
        long queueMs = settings.getQueueTimeout().toMillis();

        // 1) 裸露检测
        Outcome<DetectionSignal> nudity = config.isCategoryEnabled(SignalCategory.NUDITY)
                ? dispatch(image, SignalCategory.NUDITY,
                        () -> normalizer.detections(require(nudityAnalyzer, SignalCategory.NUDITY).detect(image), config),
                        DetectionSignal::analysisError, timeoutMs, queueMs).join()
                : disabled(image, SignalCategory.NUDITY, DetectionSignal.disabled());

        // 2) 其余三个并发
        CompletableFuture<Outcome<PoseSignal>> pose = config.isCategoryEnabled(SignalCategory.POSE)
                ? dispatch(image, SignalCategory.POSE,
                        () -> normalizer.pose(require(poseAnalyzer, SignalCategory.POSE).analyze(image)),
                        (status, err) -> PoseSignal.analysisError(status), timeoutMs, queueMs)
                : CompletableFuture.completedFuture(disabled(image, SignalCategory.POSE, PoseSignal.disabled()));

        CompletableFuture<Outcome<FaceSignal>> face = config.isCategoryEnabled(SignalCategory.FACE)
                ? dispatch(image, SignalCategory.FACE,
                        () -> normalizer.faces(require(faceAnalyzer, SignalCategory.FACE).analyze(image), settings),
                        (status, err) -> FaceSignal.none(status, settings.getMinAgeThreshold(), settings.getSuspiciousAgeThreshold()),
                        timeoutMs, queueMs)
                : CompletableFuture.completedFuture(disabled(image, SignalCategory.FACE,
                        FaceSignal.none(StageStatus.DISABLED, settings.getMinAgeThreshold(), settings.getSuspiciousAgeThreshold())));

        CompletableFuture<Outcome<DescriptionSignal>> description = config.isCategoryEnabled(SignalCategory.DESCRIPTION)
                ? dispatch(image, SignalCategory.DESCRIPTION,
                        () -> normalizer.caption(require(captionAnalyzer, SignalCategory.DESCRIPTION).describe(image), config, settings),
                        (status, err) -> DescriptionSignal.analysisError(status), timeoutMs, queueMs)
                : CompletableFuture.completedFuture(disabled(image, SignalCategory.DESCRIPTION, DescriptionSignal.disabled()));

        // 3) 汇合
        CompletableFuture.allOf(pose, face, description).join();

        return StageResults.builder()
                .detection(nudity.signal())
                .pose(pose.join().signal())
                .face(face.join().signal())
                .description(description.join().signal())
                .reports(List.of(nudity.report(), pose.join().report(), face.join().report(), description.join().report()))
                .build();
    }

    /**
     * 超时从分析器真正开始执行时起算，排队时间不计入；
     * 排队超过 queueTimeoutMs 仍未开始的阶段放弃执行，按失败兜底。
     */
    private <T> CompletableFuture<Outcome<T>> dispatch(ImageReference image,
                                                       SignalCategory category,
                                                       Supplier<T> call,
                                                       BiFunction<StageStatus, String, T> fallback,
                                                       long timeoutMs,
                                                       long queueTimeoutMs) {
        long submitted = System.nanoTime();
        // 排队中 -> 已开始 / 已放弃，二者只有一个能赢
        AtomicInteger state = new AtomicInteger(QUEUED);
        AtomicLong startedAt = new AtomicLong(submitted);
        CompletableFuture<T> future = new CompletableFuture<>();

        Runnable task = () -> {
            if (!state.compareAndSet(QUEUED, STARTED)) return;
            startedAt.set(System.nanoTime());
            future.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
            try {
                future.complete(call.get());
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        };
        try {
            executor.execute(task);
            CompletableFuture.delayedExecutor(queueTimeoutMs, TimeUnit.MILLISECONDS).execute(() -> {
                if (state.compareAndSet(QUEUED, ABANDONED)) {
                    future.completeExceptionally(new StageNotStartedException(category, queueTimeoutMs));
                }
            });
        } catch (RejectedExecutionException e) {
            state.set(ABANDONED);
            future.completeExceptionally(e);
        }

        return future.handle((signal, ex) -> {
            long end = System.nanoTime();
            long began = state.get() == STARTED ? startedAt.get() : end;
            long queuedMs = (began - submitted) / 1_000_000;
            long ms = (end - began) / 1_000_000;
            if (ex == null) {
                return finish(image, queuedMs, new Outcome<>(signal, new StageReport(category, StageStatus.OK, ms, null)));
            }
            Throwable cause = unwrap(ex);
            StageStatus status = cause instanceof TimeoutException ? StageStatus.TIMED_OUT : StageStatus.FAILED;
            String err = status == StageStatus.TIMED_OUT ? "timeout after " + timeoutMs + "ms" : cause.toString();
            log.warn("Analyzer stage fell back, stage={}, status={}, queuedMs={}, image={}, err={}",
                    category.code(), status, queuedMs, image.getLocation(), err);
            return finish(image, queuedMs, new Outcome<>(fallback.apply(status, err), new StageReport(category, status, ms, err)));
        });
    }

    private <T> Outcome<T> disabled(ImageReference image, SignalCategory category, T signal) {
        return finish(image, 0, new Outcome<>(signal, StageReport.disabled(category)));
    }

    /** 每个阶段一条结构化日志 + 一个计时 */
    private <T> Outcome<T> finish(ImageReference image, long queuedMs, Outcome<T> outcome) {
        StageReport r = outcome.report();
        log.info("stage={} status={} latencyMs={} queuedMs={} image={}",
                r.getCategory().code(), r.getStatus(), r.getLatencyMs(), queuedMs, image.getLocation());
        Timer.builder("moderation.stage.latency")
                .description("Analyzer stage latency including normalization")
                .tag("category", r.getCategory().code())
                .tag("status", r.getStatus().name().toLowerCase())
                .register(meterRegistry)
                .record(r.getLatencyMs(), TimeUnit.MILLISECONDS);
        return outcome;
    }

    private static <A> A require(Optional<A> analyzer, SignalCategory category) {
        return analyzer.orElseThrow(() -> new AnalyzerUnavailableException(category));
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable t = ex;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    record Outcome<T>(T signal, StageReport report) {}
}
