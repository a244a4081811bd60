package com.jz.moderation.analyzer;

/** 图像描述生成器 */
public interface CaptionAnalyzer {
    RawCaption describe(ImageReference image);
}
