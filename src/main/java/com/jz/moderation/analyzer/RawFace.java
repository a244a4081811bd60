package com.jz.moderation.analyzer;

import lombok.*;

import java.util.List;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class RawFace {
    private Integer age;
    private String gender;      // M / F / 其他
    private Double score;       // 检测置信度 0~1
    private List<Double> box;   // [x1, y1, x2, y2]
}
