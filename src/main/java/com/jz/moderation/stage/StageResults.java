package com.jz.moderation.stage;

import com.jz.moderation.signal.DescriptionSignal;
import com.jz.moderation.signal.DetectionSignal;
import com.jz.moderation.signal.FaceSignal;
import com.jz.moderation.signal.PoseSignal;
import com.jz.moderation.signal.StageReport;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StageResults {
    DetectionSignal detection;
    PoseSignal pose;
    FaceSignal face;
    DescriptionSignal description;
    List<StageReport> reports;
}
