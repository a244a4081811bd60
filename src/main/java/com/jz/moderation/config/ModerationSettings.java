package com.jz.moderation.config;

import com.jz.moderation.common.InvalidSettingsException;
import com.jz.moderation.policy.ContextPolicy;
import com.jz.moderation.policy.ContextPolicyTable;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 进程级配置快照。请求开始时取一次，整个请求都用这一份；
 * 管理端更新时整体替换，从不原地修改。
 */
@Value
@Builder(toBuilder = true)
public class ModerationSettings {

    public static final List<String> DEFAULT_CHILD_KEYWORDS = List.of(
            "child", "children", "kid", "kids", "baby", "babies", "toddler", "infant", "minor", "teen",
            "boy", "girl", "daughter", "son", "student", "school", "playground");
    public static final List<String> DEFAULT_RISKY_TAGS = List.of(
            "nude", "naked", "underwear", "bikini", "bedroom", "bathroom");
    public static final List<String> DEFAULT_TAG_VOCABULARY = List.of(
            "woman", "man", "person", "child", "adult", "beach", "bedroom", "bathroom",
            "bikini", "underwear", "dress", "shirt", "pants", "nude", "naked",
            "posing", "sitting", "standing", "lying", "smiling", "looking");

    /** 每次替换 +1，写进结果元数据便于追溯 */
    long revision;
    ComponentConfig defaultComponents;
    ContextPolicyTable policies;
    List<String> childKeywords;
    Set<String> riskyTags;
    List<String> tagVocabulary;
    int minAgeThreshold;
    int suspiciousAgeThreshold;
    Duration stageTimeout;
    /** 分析器任务最多排队这么久，仍未开始执行就按失败兜底 */
    Duration queueTimeout;

    public static ModerationSettings defaults() {
        return ModerationSettings.builder()
                .defaultComponents(ComponentConfig.allEnabled())
                .policies(ContextPolicyTable.defaults())
                .childKeywords(DEFAULT_CHILD_KEYWORDS)
                .riskyTags(new LinkedHashSet<>(DEFAULT_RISKY_TAGS))
                .tagVocabulary(DEFAULT_TAG_VOCABULARY)
                .minAgeThreshold(16)
                .suspiciousAgeThreshold(18)
                .stageTimeout(Duration.ofSeconds(5))
                .queueTimeout(Duration.ofSeconds(30))
                .build()
                .validated();
    }

    public static ModerationSettings fromProperties(ModerationProperties props) {
        ContextPolicyTable policies = ContextPolicyTable.defaults();
        if (props.getContexts() != null && !props.getContexts().isEmpty()) {
            Map<String, ContextPolicy> m = new LinkedHashMap<>();
            props.getContexts().forEach((k, v) ->
                    m.put(k, new ContextPolicy(k, v.getAutoApprove(), v.getAutoReject())));
            policies = ContextPolicyTable.of(props.getDefaultContext(), m);
        }
        return ModerationSettings.builder()
                .defaultComponents(ComponentConfig.fromFlatMap(props.getComponents()))
                .policies(policies)
                .childKeywords(lowerOr(props.getChildKeywords(), DEFAULT_CHILD_KEYWORDS))
                .riskyTags(new LinkedHashSet<>(lowerOr(props.getRiskyTags(), DEFAULT_RISKY_TAGS)))
                .tagVocabulary(lowerOr(props.getTagVocabulary(), DEFAULT_TAG_VOCABULARY))
                .minAgeThreshold(props.getMinAgeThreshold())
                .suspiciousAgeThreshold(props.getSuspiciousAgeThreshold())
                .stageTimeout(Duration.ofMillis(props.getStageTimeoutMs()))
                .queueTimeout(Duration.ofMillis(props.getStageQueueTimeoutMs()))
                .build()
                .validated();
    }

    /** 不合法直接抛 InvalidSettingsException；合法则返回防御性拷贝后的实例 */
    public ModerationSettings validated() {
        if (defaultComponents == null) throw new InvalidSettingsException("defaultComponents is required");
        if (policies == null) throw new InvalidSettingsException("context policies are required");
        policies.validate();
        if (minAgeThreshold <= 0 || suspiciousAgeThreshold < minAgeThreshold) {
            throw new InvalidSettingsException("age thresholds must satisfy 0 < min <= suspicious, got "
                    + minAgeThreshold + "/" + suspiciousAgeThreshold);
        }
        if (stageTimeout == null || stageTimeout.isZero() || stageTimeout.isNegative()) {
            throw new InvalidSettingsException("stageTimeout must be positive");
        }
        if (queueTimeout == null || queueTimeout.isZero() || queueTimeout.isNegative()) {
            throw new InvalidSettingsException("queueTimeout must be positive");
        }
        // 词表一律小写，下游按小写精确比较
        return toBuilder()
                .childKeywords(List.copyOf(lower(childKeywords)))
                .riskyTags(Set.copyOf(new LinkedHashSet<>(lower(riskyTags))))
                .tagVocabulary(List.copyOf(lower(tagVocabulary)))
                .build();
    }

    private static List<String> lowerOr(List<String> values, List<String> fallback) {
        if (values == null || values.isEmpty()) return fallback;
        return lower(values);
    }

    private static List<String> lower(Collection<String> values) {
        List<String> out = new ArrayList<>();
        if (values == null) return out;
        for (String v : values) {
            if (v != null && !v.isBlank()) out.add(v.trim().toLowerCase(Locale.ROOT));
        }
        return out;
    }
}
