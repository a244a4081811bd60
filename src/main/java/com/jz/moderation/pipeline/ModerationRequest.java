package com.jz.moderation.pipeline;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 单次审核请求。componentConfig 为扁平开关 map，可为 null（全部沿用默认）。
 */
@Value
@Builder
public class ModerationRequest {
    String imageRef;
    String contextType;
    Long modelId;
    Map<String, ?> componentConfig;
}
