package com.jz.moderation.analyzer;

import lombok.*;

import java.util.List;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class RawCaption {
    private String description;
    private List<String> tags;   // 生成器自带的标签，可空
    private String method;       // 例如 blip_model
}
