package com.jz.moderation.analyzer;

import java.util.List;

/** 裸露/身体部位检测器的输出契约 */
public interface NudityAnalyzer {
    List<RawDetection> detect(ImageReference image);
}
