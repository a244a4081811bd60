package com.jz.moderation.signal;

import lombok.Value;

@Value
public class BoundingBox {
    int x;
    int y;
    int width;
    int height;
    double confidence;

    /** 检测器给的是 [x1, y1, x2, y2] */
    public static BoundingBox fromCorners(double x1, double y1, double x2, double y2, double confidence) {
        return new BoundingBox((int) x1, (int) y1, (int) (x2 - x1), (int) (y2 - y1), confidence);
    }
}
