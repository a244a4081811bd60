package com.jz.moderation.analyzer;

/** 姿态/关键点估计器，返回关键点派生的几何指标 */
public interface PoseAnalyzer {
    RawPose analyze(ImageReference image);
}
