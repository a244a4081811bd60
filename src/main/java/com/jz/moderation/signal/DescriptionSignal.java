package com.jz.moderation.signal;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
@Builder
public class DescriptionSignal {
    StageStatus status;
    String description;
    /** 小写、保持插入顺序 */
    Set<String> tags;
    boolean containsChildKeywords;
    List<String> childKeywordsFound;
    String generationMethod;

    public static DescriptionSignal disabled() {
        return DescriptionSignal.builder()
                .status(StageStatus.DISABLED)
                .description("")
                .tags(Set.of())
                .childKeywordsFound(List.of())
                .generationMethod("disabled_by_config")
                .build();
    }

    public static DescriptionSignal analysisError(StageStatus status) {
        return DescriptionSignal.builder()
                .status(status)
                .description("")
                .tags(Set.of())
                .childKeywordsFound(List.of())
                .generationMethod("analysis_error")
                .build();
    }
}
