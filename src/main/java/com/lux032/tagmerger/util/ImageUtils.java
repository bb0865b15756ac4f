package com.lux032.tagmerger.util;

import com.lux032.tagmerger.exception.PictureEncodeException;
import com.lux032.tagmerger.model.CoverArt;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * 图片工具类
 * FLAC PICTURE 块需要记录图片宽高和色深，写入前先解码一次
 */
@Slf4j
public class ImageUtils {

    private ImageUtils() {
    }

    /**
     * 解析图片尺寸信息
     *
     * @param imageData 图片数据
     * @param mimeType  声明的 MIME 类型，仅支持 JPEG / PNG
     * @return 宽、高、色深
     * @throws PictureEncodeException MIME 不支持或图片无法解码
     */
    public static ImageInfo inspect(byte[] imageData, String mimeType) throws PictureEncodeException {
        if (!CoverArt.MIME_JPEG.equals(mimeType) && !CoverArt.MIME_PNG.equals(mimeType)) {
            throw new PictureEncodeException("unsupported picture MIME type: " + mimeType);
        }
        if (imageData == null || imageData.length == 0) {
            throw new PictureEncodeException("picture data is empty");
        }

        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(imageData));
        } catch (IOException | RuntimeException e) {
            // 损坏的图片数据可能让解码器抛出运行时异常
            throw new PictureEncodeException("failed to decode " + mimeType + " picture", e);
        }
        if (image == null) {
            throw new PictureEncodeException("picture data is not a readable " + mimeType + " image");
        }

        ImageInfo info = new ImageInfo(image.getWidth(), image.getHeight(),
            image.getColorModel().getPixelSize());
        log.debug("Picture {}: {}x{}, {} bpp", mimeType, info.getWidth(), info.getHeight(), info.getColourDepth());
        return info;
    }

    @Value
    public static class ImageInfo {
        int width;
        int height;
        int colourDepth;
    }
}
