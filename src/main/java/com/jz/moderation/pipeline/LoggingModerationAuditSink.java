package com.jz.moderation.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** 默认实现：整条结果序列化为 JSON 打到日志 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingModerationAuditSink implements ModerationAuditSink {

    private final ObjectMapper mapper;

    @Override
    public void record(ModerationResult result) {
        try {
            log.info("moderation.audit {}", mapper.writeValueAsString(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("audit record not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
