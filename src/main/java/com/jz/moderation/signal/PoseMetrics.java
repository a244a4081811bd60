package com.jz.moderation.signal;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 姿态估计器给出的几何指标（角度单位：度；leg spread 为归一化画面宽度）。
 */
@Value
@Builder
public class PoseMetrics {
    public static final double MAX_ANGLE = 180.0;
    public static final double MAX_LEG_SPREAD = 1.0;

    double torsoAngle;
    double hipBendAngle;
    double legSpread;
    boolean armsRaised;
    boolean leftHandNearBody;
    boolean rightHandNearBody;
    String bodyOrientation;

    /** NaN/Infinity（除零产物）或超出物理范围 */
    public boolean isImplausible() {
        return !angleInRange(torsoAngle) || !angleInRange(hipBendAngle)
                || !Double.isFinite(legSpread) || legSpread < 0 || legSpread > MAX_LEG_SPREAD;
    }

    /** 审计用的原始指标编码 */
    public List<String> toReasoningCodes() {
        List<String> out = new ArrayList<>();
        out.add("raw_metric:torso_angle=" + fmt(torsoAngle));
        out.add("raw_metric:hip_bend_angle=" + fmt(hipBendAngle));
        out.add("raw_metric:leg_spread=" + fmt(legSpread));
        out.add("raw_metric:body_orientation=" + bodyOrientation);
        return out;
    }

    private static boolean angleInRange(double a) {
        return Double.isFinite(a) && a >= 0 && a <= MAX_ANGLE;
    }

    private static String fmt(double v) {
        return Double.isFinite(v) ? String.format(Locale.ROOT, "%.3f", v) : String.valueOf(v);
    }
}
