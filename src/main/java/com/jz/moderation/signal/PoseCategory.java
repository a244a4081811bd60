package com.jz.moderation.signal;

public enum PoseCategory {
    NEUTRAL,
    MILDLY_SUGGESTIVE,
    MODERATELY_SUGGESTIVE,
    HIGHLY_SUGGESTIVE,
    FACE_ONLY_NO_POSE,
    UNCERTAIN_POSE_DETECTION,
    UNDETECTED,
    ANALYSIS_ERROR,
    DISABLED;

    public String code() {
        return name().toLowerCase();
    }
}
