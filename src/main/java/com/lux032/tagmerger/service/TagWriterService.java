package com.lux032.tagmerger.service;

import com.lux032.tagmerger.config.TaggerConfig;
import com.lux032.tagmerger.exception.PictureEncodeException;
import com.lux032.tagmerger.exception.TaggingException;
import com.lux032.tagmerger.model.CoverArt;
import com.lux032.tagmerger.model.MetadataField;
import com.lux032.tagmerger.model.MusicMetadata;
import com.lux032.tagmerger.tagger.AudioFormat;
import com.lux032.tagmerger.tagger.AudioTagger;
import com.lux032.tagmerger.tagger.TaggerFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 音乐标签写入服务
 * 把一份元数据补写到音频文件中，已有标签不会被覆盖
 */
@Slf4j
public class TagWriterService {

    private final TaggerConfig config;

    public TagWriterService(TaggerConfig config) {
        this.config = config;
    }

    /**
     * 补写标签并保存
     *
     * @param audioFile 目标文件
     * @param format    格式名，如 mp3 / flac
     * @param metadata  待写入的元数据
     * @return 交给 tagger 处理的字段（已有值的字段不会被覆盖，但仍计入）
     */
    public Set<MetadataField> writeTags(File audioFile, String format, MusicMetadata metadata)
            throws TaggingException {
        AudioFormat audioFormat = AudioFormat.fromName(format);
        log.info("Updating tags: {} ({})", audioFile.getName(), audioFormat.getName());

        AudioTagger tagger = TaggerFactory.open(audioFile, audioFormat, config);
        Set<MetadataField> applied = EnumSet.noneOf(MetadataField.class);

        // 1. 封面
        if (writeCover(tagger, metadata)) {
            applied.add(MetadataField.COVER);
        }

        // 2. 文本标签
        if (isNotEmpty(metadata.getTitle())) {
            tagger.setTitle(metadata.getTitle());
            applied.add(MetadataField.TITLE);
        }
        if (isNotEmpty(metadata.getAlbum())) {
            tagger.setAlbum(metadata.getAlbum());
            applied.add(MetadataField.ALBUM);
        }
        List<String> artists = nonEmptyArtists(metadata.getArtists());
        if (!artists.isEmpty()) {
            tagger.setArtist(artists);
            applied.add(MetadataField.ARTIST);
        }
        if (isNotEmpty(metadata.getComment())) {
            tagger.setComment(metadata.getComment());
            // FLAC 会忽略注释
            if (audioFormat == AudioFormat.MP3) {
                applied.add(MetadataField.COMMENT);
            }
        }

        // 3. 保存
        tagger.save();
        log.info("Tags written: {} {}", audioFile.getName(), applied);
        return applied;
    }

    /**
     * 写入封面
     * 图片无法编码时只记录警告，其余字段照常写入
     *
     * @return 是否写入了封面
     */
    private boolean writeCover(AudioTagger tagger, MusicMetadata metadata) throws TaggingException {
        boolean useUrl = metadata.hasCoverArtUrl()
            && (config.isPreferCoverUrl() || !metadata.hasCoverArtData());

        if (useUrl) {
            log.info("Writing cover url: {}", metadata.getCoverArtUrl());
            tagger.setCoverUrl(metadata.getCoverArtUrl());
            return true;
        }
        if (!metadata.hasCoverArtData()) {
            return false;
        }

        String mimeType = metadata.getCoverMimeType();
        if (!isNotEmpty(mimeType)) {
            mimeType = CoverArt.detectMimeType(metadata.getCoverArtData());
        }
        log.info("Writing cover image: {} KB, {}", metadata.getCoverArtData().length / 1024, mimeType);
        try {
            tagger.setCover(metadata.getCoverArtData(), mimeType);
            return true;
        } catch (PictureEncodeException e) {
            log.warn("Skipping cover for {}: {}", tagger.getFile().getName(), e.getMessage());
            return false;
        }
    }

    private static List<String> nonEmptyArtists(List<String> artists) {
        List<String> result = new ArrayList<>();
        if (artists != null) {
            for (String artist : artists) {
                if (isNotEmpty(artist)) {
                    result.add(artist);
                }
            }
        }
        return result;
    }

    private static boolean isNotEmpty(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
