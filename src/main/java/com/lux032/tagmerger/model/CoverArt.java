package com.lux032.tagmerger.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * 封面引用
 *
 * 两种表示方式：
 * 1. 内嵌图片：payload 为图片二进制数据，MIME 为真实图片类型
 * 2. 外部链接：payload 为 URL 字符串的字节，MIME 固定为 {@value #URL_MIME_SENTINEL}
 *
 * ID3v2 APIC 帧和 FLAC PICTURE 块都使用同一约定，兼容读取方据此判断 payload 是否为链接。
 */
@Getter
@EqualsAndHashCode
public final class CoverArt {

    /** 表示 payload 为 URL 的保留 MIME 值，必须逐字节一致 */
    public static final String URL_MIME_SENTINEL = "-->";

    /** 封面图片类型：Front cover，ID3v2 APIC 与 FLAC PICTURE 编号相同 */
    public static final int PICTURE_TYPE_FRONT_COVER = 3;

    public static final String MIME_JPEG = "image/jpeg";
    public static final String MIME_PNG = "image/png";

    private static final byte[] PNG_SIGNATURE = {
        (byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'
    };

    private final String mimeType;
    private final byte[] payload;

    private CoverArt(String mimeType, byte[] payload) {
        this.mimeType = mimeType;
        this.payload = payload;
    }

    /**
     * 内嵌图片数据
     */
    public static CoverArt embedded(byte[] imageData, String mimeType) {
        Objects.requireNonNull(imageData, "imageData");
        Objects.requireNonNull(mimeType, "mimeType");
        return new CoverArt(mimeType, imageData);
    }

    /**
     * 外部链接，URL 按 UTF-8 编码写入 payload
     */
    public static CoverArt linked(String coverUrl) {
        Objects.requireNonNull(coverUrl, "coverUrl");
        return new CoverArt(URL_MIME_SENTINEL, coverUrl.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isLinked() {
        return URL_MIME_SENTINEL.equals(mimeType);
    }

    /**
     * @return 链接形式的 URL；内嵌图片返回 null
     */
    public String getUrl() {
        return isLinked() ? new String(payload, StandardCharsets.UTF_8) : null;
    }

    /**
     * 根据文件头识别图片类型，PNG 以外一律按 JPEG 处理
     */
    public static String detectMimeType(byte[] imageData) {
        if (imageData != null && imageData.length >= PNG_SIGNATURE.length
            && Arrays.equals(Arrays.copyOf(imageData, PNG_SIGNATURE.length), PNG_SIGNATURE)) {
            return MIME_PNG;
        }
        return MIME_JPEG;
    }

    @Override
    public String toString() {
        return isLinked() ? "CoverArt{url=" + getUrl() + "}"
            : "CoverArt{mime=" + mimeType + ", " + payload.length + " bytes}";
    }
}
