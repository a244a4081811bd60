package com.jz.moderation.analyzer;

import com.jz.moderation.common.ImageUnreadableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.util.Locale;

/**
 * 本地文件用 ImageIO 试解码；http(s) 等远程引用交给分析器自己拉取，这里不解码。
 */
@Slf4j
@Component
public class ImageIoImageProbe implements ImageProbe {

    @Override
    public ImageInfo probe(ImageReference image) {
        String loc = image.getLocation();
        String lower = loc.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return ImageInfo.remote();
        }
        File file = lower.startsWith("file:") ? new File(URI.create(loc)) : new File(loc);
        if (!file.isFile()) {
            throw new ImageUnreadableException("image not found: " + loc);
        }
        try {
            BufferedImage img = ImageIO.read(file);
            if (img == null) {
                throw new ImageUnreadableException("could not decode image: " + loc);
            }
            log.debug("probed image={}, size={}x{}", loc, img.getWidth(), img.getHeight());
            return new ImageInfo(img.getWidth(), img.getHeight(), true);
        } catch (IOException e) {
            throw new ImageUnreadableException("could not read image: " + loc, e);
        }
    }
}
