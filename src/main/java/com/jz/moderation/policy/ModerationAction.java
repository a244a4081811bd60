package com.jz.moderation.policy;

public enum ModerationAction {
    APPROVE_AUTOMATICALLY,
    REQUIRE_HUMAN_REVIEW,
    REJECT_AUTOMATICALLY,
    REJECT_UNDERAGE_CONTENT,
    REJECT_CHILD_CONTENT
}
