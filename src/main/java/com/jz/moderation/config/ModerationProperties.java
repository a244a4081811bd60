package com.jz.moderation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "moderation")
public class ModerationProperties {

    /** 缺省组件开关，键同 DetectionToggle.key()；没配的按开启 */
    private Map<String, Boolean> components = new LinkedHashMap<>();

    /** 场景 -> 自动通过/自动拒绝阈值 */
    private Map<String, Thresholds> contexts = new LinkedHashMap<>();

    /** 未知场景回落到这个（要求是最严格的那个） */
    private String defaultContext = "public_gallery";

    /** 低于此年龄直接拒绝 */
    private int minAgeThreshold = 16;

    /** 低于此年龄风险 ×1.5 */
    private int suspiciousAgeThreshold = 18;

    /** 单个分析器调用超时，超时按失败兜底 */
    private long stageTimeoutMs = 5000;

    /** 分析器任务在线程池里最多排队多久，超过按失败兜底 */
    private long stageQueueTimeoutMs = 30000;

    private List<String> childKeywords = new ArrayList<>();

    private List<String> riskyTags = new ArrayList<>();

    /** 从描述文本里抽标签用的词表 */
    private List<String> tagVocabulary = new ArrayList<>();

    private Executor executor = new Executor();

    @Data
    public static class Thresholds {
        private double autoApprove;
        private double autoReject;
    }

    @Data
    public static class Executor {
        // 一次审核提交 4 个分析器任务（裸露在前，其余三个并发），按 8 路并发请求估算
        private int corePoolSize = 32;
        private int maxPoolSize = 64;
        private int queueCapacity = 500;
        private String threadNamePrefix = "analyzer-";
    }
}
