package com.lux032.tagmerger.tagger;

import com.lux032.tagmerger.config.TaggerConfig;
import com.lux032.tagmerger.exception.TaggingException;
import com.lux032.tagmerger.exception.UnsupportedFormatException;

import java.io.File;

/**
 * 根据格式名创建对应的 {@link AudioTagger}
 */
public final class TaggerFactory {

    private TaggerFactory() {
    }

    public static AudioTagger open(File file, String format) throws TaggingException {
        // 先校验格式，不支持的格式不做任何文件读取
        AudioFormat audioFormat = AudioFormat.fromName(format);
        return open(file, audioFormat, TaggerConfig.getInstance());
    }

    public static AudioTagger open(File file, String format, TaggerConfig config) throws TaggingException {
        return open(file, AudioFormat.fromName(format), config);
    }

    /**
     * 根据文件扩展名推断格式
     */
    public static AudioTagger open(File file) throws TaggingException {
        String name = file.getName();
        int dotIndex = name.lastIndexOf('.');
        if (dotIndex <= 0 || dotIndex == name.length() - 1) {
            throw new UnsupportedFormatException(name);
        }
        return open(file, name.substring(dotIndex + 1));
    }

    public static AudioTagger open(File file, AudioFormat format, TaggerConfig config) throws TaggingException {
        switch (format) {
            case MP3:
                return new Mp3Tagger(file, config);
            case FLAC:
                return new FlacTagger(file, config);
            default:
                throw new UnsupportedFormatException(format.getName());
        }
    }
}
