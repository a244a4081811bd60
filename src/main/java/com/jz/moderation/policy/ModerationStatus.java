package com.jz.moderation.policy;

public enum ModerationStatus {
    APPROVED,
    FLAGGED_FOR_REVIEW,
    REJECTED
}
