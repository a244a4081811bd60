package com.jz.moderation.analyzer;

/**
 * 在调用任何分析器之前确认图片可读。
 * 不可读抛 {@link com.jz.moderation.common.ImageUnreadableException}。
 */
public interface ImageProbe {
    ImageInfo probe(ImageReference image);
}
