package com.lux032.tagmerger.tagger;

import com.lux032.tagmerger.exception.TaggingException;

import java.io.File;
import java.util.List;

/**
 * MP3 与 FLAC 共用的标签写入接口
 *
 * 一个实例对应一次会话：构造时读取文件已有标签，setter 只修改内存中的状态，
 * 调用 {@link #save()} 后才写回文件。未调用 save 则不会有任何改动落盘。
 *
 * 文本字段采用"缺失才填充"策略：文件中已有的值优先，不会被覆盖。
 * 封面不做存在性检查，每次调用都追加一张新的封面。
 *
 * 实现类不是线程安全的，同一路径也不应同时存在两个会话。
 */
public interface AudioTagger {

    /**
     * 追加一张内嵌图片作为封面
     *
     * @param imageData 图片数据
     * @param mimeType  真实的图片 MIME 类型
     */
    void setCover(byte[] imageData, String mimeType) throws TaggingException;

    /**
     * 追加一张以 URL 引用的封面，MIME 写为 {@code "-->"}，图片数据为 URL 本身
     */
    void setCoverUrl(String coverUrl) throws TaggingException;

    void setTitle(String title) throws TaggingException;

    void setAlbum(String album) throws TaggingException;

    /**
     * 文件中没有任何艺术家时，按顺序逐个写入
     */
    void setArtist(List<String> artists) throws TaggingException;

    /**
     * 不支持注释的格式直接忽略，不报错
     */
    void setComment(String comment) throws TaggingException;

    /**
     * 将累计的修改写回原文件，每个会话只能调用一次
     */
    void save() throws TaggingException;

    File getFile();

    AudioFormat getFormat();
}
