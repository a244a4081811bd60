package com.jz.moderation.service;

import com.jz.moderation.config.ModerationSettings;
import com.jz.moderation.policy.ContextPolicy;

import java.util.Map;

/**
 * 运行期配置管理。每次更新都先校验再整体替换快照，校验失败抛
 * {@link com.jz.moderation.common.InvalidSettingsException}，当前快照保持不变。
 */
public interface ModerationAdminService {

    /** 当前生效的快照 */
    ModerationSettings active();

    /** 启动时从配置文件加载的快照 */
    ModerationSettings defaults();

    /** 叠加到缺省组件开关上；键和取值规则同请求里的 componentConfig */
    ModerationSettings updateComponentDefaults(Map<String, ?> components);

    /** 新增或替换场景阈值 */
    ModerationSettings updateContextPolicies(Map<String, ContextPolicy> policies);

    ModerationSettings replace(ModerationSettings settings);

    ModerationSettings resetToDefaults();
}
