package com.jz.moderation.service.impl;

import com.jz.moderation.common.InvalidSettingsException;
import com.jz.moderation.config.ModerationSettings;
import com.jz.moderation.config.ModerationSettingsHolder;
import com.jz.moderation.policy.ContextPolicy;
import com.jz.moderation.policy.ContextPolicyTable;
import com.jz.moderation.service.ModerationAdminService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ModerationAdminServiceImpl implements ModerationAdminService {

    private final ModerationSettingsHolder holder;

    @Override
    public ModerationSettings active() {
        return holder.current();
    }

    @Override
    public ModerationSettings defaults() {
        return holder.initial();
    }

    @Override
    public ModerationSettings updateComponentDefaults(Map<String, ?> components) {
        if (components == null || components.isEmpty()) {
            throw new InvalidSettingsException("component update is empty");
        }
        ModerationSettings next = holder.update(prev -> prev.toBuilder()
                .defaultComponents(prev.getDefaultComponents().overlay(components))
                .build());
        log.info("Default components updated: {}", next.getDefaultComponents());
        return next;
    }

    @Override
    public ModerationSettings updateContextPolicies(Map<String, ContextPolicy> policies) {
        if (policies == null || policies.isEmpty()) {
            throw new InvalidSettingsException("context policy update is empty");
        }
        ModerationSettings next = holder.update(prev -> {
            ContextPolicyTable table = prev.getPolicies();
            Map<String, ContextPolicy> merged = new LinkedHashMap<>(table.getPolicies());
            policies.forEach((key, p) -> {
                if (p == null) throw new InvalidSettingsException("policy for " + key + " is null");
                // 键以 map 的 key 为准
                merged.put(key, new ContextPolicy(key, p.getAutoApproveThreshold(), p.getAutoRejectThreshold()));
            });
            return prev.toBuilder()
                    .policies(ContextPolicyTable.of(table.getDefaultContext(), merged))
                    .build();
        });
        log.info("Context policies updated: {}", policies.keySet());
        return next;
    }

    @Override
    public ModerationSettings replace(ModerationSettings settings) {
        if (settings == null) throw new InvalidSettingsException("settings are required");
        return holder.update(prev -> settings);
    }

    @Override
    public ModerationSettings resetToDefaults() {
        log.info("Resetting moderation settings to startup defaults");
        return holder.update(prev -> holder.initial());
    }
}
