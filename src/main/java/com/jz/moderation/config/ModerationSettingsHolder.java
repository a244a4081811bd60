package com.jz.moderation.config;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * 读多写少的配置快照持有者。进行中的请求继续用它开始时拿到的那份。
 */
@Slf4j
public class ModerationSettingsHolder {

    private final ModerationSettings initial;
    private final AtomicReference<ModerationSettings> active;

    public ModerationSettingsHolder(ModerationSettings initial) {
        this.initial = initial.validated();
        this.active = new AtomicReference<>(this.initial);
    }

    public ModerationSettings current() {
        return active.get();
    }

    /** 启动时的快照 */
    public ModerationSettings initial() {
        return initial;
    }

    /**
     * 基于当前快照生成新快照并原子替换；校验失败时抛异常，旧快照不变。
     */
    public ModerationSettings update(UnaryOperator<ModerationSettings> change) {
        ModerationSettings next = active.updateAndGet(prev -> {
            ModerationSettings candidate = change.apply(prev).validated();
            return candidate.toBuilder().revision(prev.getRevision() + 1).build();
        });
        log.info("Moderation settings replaced, revision={}", next.getRevision());
        return next;
    }
}
