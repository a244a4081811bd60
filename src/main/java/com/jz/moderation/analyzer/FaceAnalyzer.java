package com.jz.moderation.analyzer;

import java.util.List;

/** 人脸检测 + 年龄/性别估计 */
public interface FaceAnalyzer {
    List<RawFace> analyze(ImageReference image);
}
