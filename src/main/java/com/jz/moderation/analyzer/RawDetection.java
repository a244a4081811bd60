package com.jz.moderation.analyzer;

import lombok.*;

import java.util.List;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class RawDetection {
    private String label;   // 例如 FEMALE_BREAST_EXPOSED / FACE_FEMALE
    private Double score;   // 0~1
    private List<Double> box; // [x1, y1, x2, y2]，可空
}
