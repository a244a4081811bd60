package com.jz.moderation.signal;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 裸露/身体部位检测结果。置信度统一为百分比 0~100。
 */
@Value
@Builder(access = lombok.AccessLevel.PRIVATE)
public class DetectionSignal {

    /** 超过这个分数才算 has_nudity */
    public static final double NUDITY_TRIGGER = 30.0;
    public static final String ANALYSIS_ERROR_LABEL = "ANALYSIS_ERROR";
    public static final double ANALYSIS_ERROR_SCORE = 95.0;
    public static final Set<String> FACE_ONLY_LABELS = Set.of("FACE_FEMALE", "FACE_MALE");

    StageStatus status;
    Map<String, Double> detectedParts;
    Map<String, BoundingBox> partLocations;
    double nudityScore;
    boolean hasNudity;
    int rawDetectionCount;
    int filteredDetectionCount;
    List<String> filteredLabels;
    String error;

    public static DetectionSignal of(StageStatus status,
                                     Map<String, Double> parts,
                                     Map<String, BoundingBox> locations,
                                     int rawCount,
                                     List<String> filteredLabels) {
        Map<String, Double> clamped = new LinkedHashMap<>();
        double max = 0;
        for (var e : parts.entrySet()) {
            double c = clamp(e.getValue());
            clamped.put(e.getKey(), c);
            max = Math.max(max, c);
        }
        return DetectionSignal.builder()
                .status(status)
                .detectedParts(Collections.unmodifiableMap(clamped))
                .partLocations(Collections.unmodifiableMap(new LinkedHashMap<>(locations)))
                .nudityScore(max)
                .hasNudity(max > NUDITY_TRIGGER)
                .rawDetectionCount(rawCount)
                .filteredDetectionCount(clamped.size())
                .filteredLabels(List.copyOf(filteredLabels))
                .build();
    }

    /** 检测失败时按最坏情况处理：宁可误送人工，也不能漏放 */
    public static DetectionSignal analysisError(StageStatus status, String error) {
        return DetectionSignal.builder()
                .status(status)
                .detectedParts(Map.of(ANALYSIS_ERROR_LABEL, ANALYSIS_ERROR_SCORE))
                .partLocations(Map.of())
                .nudityScore(ANALYSIS_ERROR_SCORE)
                .hasNudity(true)
                .rawDetectionCount(0)
                .filteredDetectionCount(1)
                .filteredLabels(List.of())
                .error(error)
                .build();
    }

    public static DetectionSignal disabled() {
        return DetectionSignal.builder()
                .status(StageStatus.DISABLED)
                .detectedParts(Map.of())
                .partLocations(Map.of())
                .nudityScore(0)
                .hasNudity(false)
                .filteredLabels(List.of())
                .build();
    }

    /** 只检出了一个部位，而且是人脸 */
    public boolean isFaceOnly() {
        return detectedParts.size() == 1 && FACE_ONLY_LABELS.containsAll(detectedParts.keySet());
    }

    static double clamp(Double v) {
        if (v == null || v.isNaN()) return 0;
        return Math.max(0, Math.min(100, v));
    }
}
