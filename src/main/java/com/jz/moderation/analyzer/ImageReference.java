package com.jz.moderation.analyzer;

import lombok.Value;

/** 图片引用：本地路径、file: URI 或分析器能识别的远程地址 */
@Value(staticConstructor = "of")
public class ImageReference {
    String location;
}
