package com.jz.moderation.signal;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 人脸/年龄估计结果。没有人脸时 minAge/maxAge 为 null，两个年龄标记恒为 false。
 */
@Value
@Builder(access = lombok.AccessLevel.PRIVATE)
public class FaceSignal {
    StageStatus status;
    List<FaceRecord> faces;
    boolean facesDetected;
    int faceCount;
    Integer minAge;
    Integer maxAge;
    boolean underageDetected;
    boolean suspiciousAge;
    int minAgeThreshold;
    int suspiciousAgeThreshold;
    int under16Count;
    int under18Count;
    int adultCount;

    public static FaceSignal of(StageStatus status, List<FaceRecord> faces,
                                int minAgeThreshold, int suspiciousAgeThreshold) {
        if (faces == null || faces.isEmpty()) {
            return none(status, minAgeThreshold, suspiciousAgeThreshold);
        }
        int min = Integer.MAX_VALUE, max = Integer.MIN_VALUE;
        int u16 = 0, u18 = 0, adult = 0;
        for (FaceRecord f : faces) {
            min = Math.min(min, f.getAge());
            max = Math.max(max, f.getAge());
            if (f.getAge() < 16) u16++;
            if (f.getAge() < 18) u18++; else adult++;
        }
        return FaceSignal.builder()
                .status(status)
                .faces(List.copyOf(faces))
                .facesDetected(true)
                .faceCount(faces.size())
                .minAge(min)
                .maxAge(max)
                .underageDetected(min < minAgeThreshold)
                .suspiciousAge(min < suspiciousAgeThreshold)
                .minAgeThreshold(minAgeThreshold)
                .suspiciousAgeThreshold(suspiciousAgeThreshold)
                .under16Count(u16)
                .under18Count(u18)
                .adultCount(adult)
                .build();
    }

    public static FaceSignal none(StageStatus status, int minAgeThreshold, int suspiciousAgeThreshold) {
        return FaceSignal.builder()
                .status(status)
                .faces(List.of())
                .minAgeThreshold(minAgeThreshold)
                .suspiciousAgeThreshold(suspiciousAgeThreshold)
                .build();
    }

    /** 真实跑过且检出了人脸，才算有年龄证据 */
    public boolean hasAgeEvidence() {
        return status == StageStatus.OK && facesDetected;
    }
}
