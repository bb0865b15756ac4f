package com.lux032.tagmerger.model;

/**
 * 支持写入的元数据字段
 */
public enum MetadataField {
    TITLE,
    ALBUM,
    ARTIST,
    COMMENT, // 仅 MP3 生效
    COVER
}
