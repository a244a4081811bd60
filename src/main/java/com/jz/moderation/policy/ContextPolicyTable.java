package com.jz.moderation.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.jz.moderation.common.InvalidSettingsException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 场景阈值表。表是数据：从配置加载，可整体替换；未知场景回落到默认条目。
 */
@EqualsAndHashCode
public final class ContextPolicyTable {

    public static final String PUBLIC_GALLERY = "public_gallery";
    public static final String PRIVATE_GALLERY = "private_gallery";
    public static final String PAYSITE_CONTENT = "paysite_content";
    public static final String PROFILE_PIC = "profile_pic";

    @Getter
    private final String defaultContext;
    private final Map<String, ContextPolicy> policies;

    private ContextPolicyTable(String defaultContext, Map<String, ContextPolicy> policies) {
        this.defaultContext = defaultContext;
        this.policies = Collections.unmodifiableMap(new LinkedHashMap<>(policies));
    }

    public static ContextPolicyTable of(String defaultContext, Map<String, ContextPolicy> policies) {
        ContextPolicyTable t = new ContextPolicyTable(defaultContext, policies);
        t.validate();
        return t;
    }

    public static ContextPolicyTable defaults() {
        Map<String, ContextPolicy> m = new LinkedHashMap<>();
        m.put(PUBLIC_GALLERY, new ContextPolicy(PUBLIC_GALLERY, 20, 80));
        m.put(PRIVATE_GALLERY, new ContextPolicy(PRIVATE_GALLERY, 60, 95));
        m.put(PAYSITE_CONTENT, new ContextPolicy(PAYSITE_CONTENT, 70, 90));
        m.put(PROFILE_PIC, new ContextPolicy(PROFILE_PIC, 20, 80));
        return of(PUBLIC_GALLERY, m);
    }

    /** 未知或空的场景键 -> 默认条目 */
    public ContextPolicy resolve(String contextType) {
        if (contextType != null) {
            ContextPolicy p = policies.get(contextType.trim());
            if (p != null) return p;
        }
        return policies.get(defaultContext);
    }

    public boolean isKnown(String contextType) {
        return contextType != null && policies.containsKey(contextType.trim());
    }

    public Map<String, ContextPolicy> getPolicies() {
        return policies;
    }

    /** 返回替换了/新增了一个条目的新表 */
    public ContextPolicyTable with(ContextPolicy policy) {
        Map<String, ContextPolicy> m = new LinkedHashMap<>(policies);
        m.put(policy.getContextType(), policy);
        return of(defaultContext, m);
    }

    @JsonIgnore
    public ContextPolicy getDefaultPolicy() {
        return policies.get(defaultContext);
    }

    /** 每条阈值合法，且默认条目是最严格的（两个阈值都不高于任何其他条目） */
    public void validate() {
        if (defaultContext == null || !policies.containsKey(defaultContext)) {
            throw new InvalidSettingsException("default context '" + defaultContext + "' has no policy entry");
        }
        for (var e : policies.entrySet()) {
            ContextPolicy p = e.getValue();
            if (p == null || !e.getKey().equals(p.getContextType())) {
                throw new InvalidSettingsException("policy entry mismatch for key " + e.getKey());
            }
            double a = p.getAutoApproveThreshold(), r = p.getAutoRejectThreshold();
            if (a < 0 || a > 100 || r < 0 || r > 100 || a >= r) {
                throw new InvalidSettingsException("context " + e.getKey()
                        + " needs 0 <= autoApprove < autoReject <= 100, got " + a + "/" + r);
            }
        }
        ContextPolicy d = policies.get(defaultContext);
        for (ContextPolicy p : policies.values()) {
            if (p.getAutoApproveThreshold() < d.getAutoApproveThreshold()
                    || p.getAutoRejectThreshold() < d.getAutoRejectThreshold()) {
                throw new InvalidSettingsException("context " + p.getContextType() + " ("
                        + p.getAutoApproveThreshold() + "/" + p.getAutoRejectThreshold()
                        + ") is stricter than default context " + defaultContext + " ("
                        + d.getAutoApproveThreshold() + "/" + d.getAutoRejectThreshold() + ")");
            }
        }
    }
}
