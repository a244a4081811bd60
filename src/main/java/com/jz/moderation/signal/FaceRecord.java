package com.jz.moderation.signal;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FaceRecord {
    int faceId;
    int age;
    /** M / F / Unknown */
    String gender;
    double confidence;
    BoundingBox box;
}
