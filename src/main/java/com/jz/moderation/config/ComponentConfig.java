package com.jz.moderation.config;

import com.fasterxml.jackson.annotation.JsonValue;
import com.jz.moderation.signal.SignalCategory;
import lombok.EqualsAndHashCode;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 每个请求的组件开关。不可变；关掉的组件不参与风险计算，而不只是不展示。
 */
@Slf4j
@EqualsAndHashCode
public final class ComponentConfig {

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes", "on");
    private static final Set<String> FALSE_VALUES = Set.of("false", "0", "no", "off");

    private final Set<DetectionToggle> disabled;

    private ComponentConfig(Set<DetectionToggle> disabled) {
        this.disabled = disabled.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(DetectionToggle.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(disabled));
    }

    public static ComponentConfig allEnabled() {
        return new ComponentConfig(EnumSet.noneOf(DetectionToggle.class));
    }

    /** 扁平 map 解析；缺省/非法值一律按开启处理 */
    public static ComponentConfig fromFlatMap(Map<String, ?> flat) {
        return allEnabled().overlay(flat);
    }

    /**
     * 以当前配置为底，叠加请求里的键。
     * 缺省键沿用底配置，取值非法的键按最安全的“开启”处理，未知键忽略。
     */
    public ComponentConfig overlay(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) return this;
        EnumSet<DetectionToggle> next = disabled.isEmpty()
                ? EnumSet.noneOf(DetectionToggle.class) : EnumSet.copyOf(disabled);
        for (var e : overrides.entrySet()) {
            Optional<DetectionToggle> toggle = DetectionToggle.fromKey(e.getKey());
            if (toggle.isEmpty()) {
                log.warn("Unknown component key ignored: {}", e.getKey());
                continue;
            }
            if (parseEnabled(e.getKey(), e.getValue())) next.remove(toggle.get());
            else next.add(toggle.get());
        }
        return new ComponentConfig(next);
    }

    public ComponentConfig with(DetectionToggle toggle, boolean enabled) {
        EnumSet<DetectionToggle> next = disabled.isEmpty()
                ? EnumSet.noneOf(DetectionToggle.class) : EnumSet.copyOf(disabled);
        if (enabled) next.remove(toggle); else next.add(toggle);
        return new ComponentConfig(next);
    }

    public boolean isEnabled(DetectionToggle toggle) {
        return !disabled.contains(toggle);
    }

    /** 类别是否需要调用对应分析器 */
    public boolean isCategoryEnabled(SignalCategory category) {
        return switch (category) {
            case NUDITY -> isEnabled(DetectionToggle.BREAST_DETECTION)
                    || isEnabled(DetectionToggle.GENITALIA_DETECTION)
                    || isEnabled(DetectionToggle.BUTTOCKS_DETECTION)
                    || isEnabled(DetectionToggle.ANUS_DETECTION)
                    || isEnabled(DetectionToggle.FACE_DETECTION);
            case POSE -> isEnabled(DetectionToggle.POSE_ANALYSIS);
            case FACE -> isEnabled(DetectionToggle.AGE_ESTIMATION);
            case DESCRIPTION -> isEnabled(DetectionToggle.IMAGE_DESCRIPTION);
        };
    }

    /** 儿童关键词扫描依赖描述生成 */
    public boolean isChildScanEnabled() {
        return isEnabled(DetectionToggle.CHILD_CONTENT_DETECTION)
                && isEnabled(DetectionToggle.IMAGE_DESCRIPTION);
    }

    public Set<DetectionToggle> disabledToggles() {
        return disabled;
    }

    @JsonValue
    public Map<String, Boolean> toFlatMap() {
        Map<String, Boolean> out = new LinkedHashMap<>();
        for (DetectionToggle t : DetectionToggle.values()) out.put(t.key(), isEnabled(t));
        return out;
    }

    @Override
    public String toString() {
        return "ComponentConfig" + toFlatMap();
    }

    private static boolean parseEnabled(String key, Object value) {
        if (value instanceof Boolean b) return b;
        if (value != null) {
            String s = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
            if (TRUE_VALUES.contains(s)) return true;
            if (FALSE_VALUES.contains(s)) return false;
        }
        log.warn("Invalid value for component key {}: {}, defaulting to enabled", key, value);
        return true;
    }
}
