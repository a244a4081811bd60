package com.jz.moderation.config;

import com.jz.moderation.signal.SignalCategory;

import java.util.Locale;
import java.util.Optional;

/**
 * 组件开关（闭集）。key 与请求里的扁平 map 键一致，也接受 enable_ 前缀。
 */
public enum DetectionToggle {
    BREAST_DETECTION("breast_detection", SignalCategory.NUDITY, "BREAST"),
    GENITALIA_DETECTION("genitalia_detection", SignalCategory.NUDITY, "GENITALIA"),
    BUTTOCKS_DETECTION("buttocks_detection", SignalCategory.NUDITY, "BUTTOCKS"),
    ANUS_DETECTION("anus_detection", SignalCategory.NUDITY, "ANUS"),
    FACE_DETECTION("face_detection", SignalCategory.NUDITY, "FACE"),
    POSE_ANALYSIS("pose_analysis", SignalCategory.POSE, null),
    AGE_ESTIMATION("age_estimation", SignalCategory.FACE, null),
    CHILD_CONTENT_DETECTION("child_content_detection", SignalCategory.DESCRIPTION, null),
    IMAGE_DESCRIPTION("image_description", SignalCategory.DESCRIPTION, null);

    private static final String ENABLE_PREFIX = "enable_";

    private final String key;
    private final SignalCategory category;
    /** 检测标签里的部位词，比如 FEMALE_BREAST_EXPOSED -> BREAST */
    private final String labelToken;

    DetectionToggle(String key, SignalCategory category, String labelToken) {
        this.key = key;
        this.category = category;
        this.labelToken = labelToken;
    }

    public String key() {
        return key;
    }

    public SignalCategory category() {
        return category;
    }

    public static Optional<DetectionToggle> fromKey(String raw) {
        if (raw == null) return Optional.empty();
        String k = raw.trim().toLowerCase(Locale.ROOT);
        if (k.startsWith(ENABLE_PREFIX)) k = k.substring(ENABLE_PREFIX.length());
        // 旧表单里叫 enable_child_detection
        if (k.equals("child_detection")) return Optional.of(CHILD_CONTENT_DETECTION);
        for (DetectionToggle t : values()) {
            if (t.key.equals(k)) return Optional.of(t);
        }
        return Optional.empty();
    }

    /** 检测标签归属哪个开关；未知标签返回 empty（默认保留） */
    public static Optional<DetectionToggle> forLabel(String label) {
        if (label == null) return Optional.empty();
        String upper = label.toUpperCase(Locale.ROOT);
        for (String token : upper.split("_")) {
            for (DetectionToggle t : values()) {
                if (t.labelToken != null && t.labelToken.equals(token)) return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
