package com.jz.moderation.analyzer;

import lombok.Value;

@Value
public class ImageInfo {
    /** 远程引用不在本地解码，宽高记为 -1 */
    int width;
    int height;
    boolean decodedLocally;

    public static ImageInfo remote() {
        return new ImageInfo(-1, -1, false);
    }
}
