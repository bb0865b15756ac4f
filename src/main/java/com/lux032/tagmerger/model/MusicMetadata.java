package com.lux032.tagmerger.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 待写入音频文件的元数据
 * 空字段在写入时跳过
 */
@Data
public class MusicMetadata {
    private String title;
    private String album;
    private List<String> artists = new ArrayList<>();
    private String comment;

    // 封面：图片数据和 URL 二选一，两者都有时由配置决定优先级
    private byte[] coverArtData;
    private String coverMimeType; // 为空时根据图片头部自动识别
    private String coverArtUrl;

    public boolean hasCoverArtData() {
        return coverArtData != null && coverArtData.length > 0;
    }

    public boolean hasCoverArtUrl() {
        return coverArtUrl != null && !coverArtUrl.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("MusicMetadata{title='%s', album='%s', artists=%s, cover=%s}",
            title, album, artists,
            hasCoverArtData() ? coverArtData.length + " bytes" : (hasCoverArtUrl() ? coverArtUrl : "none"));
    }
}
