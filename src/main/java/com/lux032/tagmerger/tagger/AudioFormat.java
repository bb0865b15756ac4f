package com.lux032.tagmerger.tagger;

import com.lux032.tagmerger.exception.UnsupportedFormatException;

import java.util.Locale;

/**
 * 支持的音频容器格式
 */
public enum AudioFormat {
    MP3("mp3"),
    FLAC("flac");

    private final String name;

    AudioFormat(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * 按名称查找格式，大小写不敏感
     */
    public static AudioFormat fromName(String format) throws UnsupportedFormatException {
        if (format != null) {
            String normalized = format.toLowerCase(Locale.ROOT);
            for (AudioFormat value : values()) {
                if (value.name.equals(normalized)) {
                    return value;
                }
            }
        }
        throw new UnsupportedFormatException(format);
    }
}
