package com.lux032.tagmerger.tagger;

import com.lux032.tagmerger.config.TaggerConfig;
import com.lux032.tagmerger.exception.TagIoException;
import com.lux032.tagmerger.exception.TagParseException;
import com.lux032.tagmerger.exception.TaggingException;
import com.lux032.tagmerger.model.CoverArt;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.exceptions.CannotReadException;
import org.jaudiotagger.audio.exceptions.CannotWriteException;
import org.jaudiotagger.audio.exceptions.InvalidAudioFrameException;
import org.jaudiotagger.audio.exceptions.ReadOnlyFileException;
import org.jaudiotagger.audio.mp3.MP3File;
import org.jaudiotagger.tag.FieldDataInvalidException;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.TagException;
import org.jaudiotagger.tag.TagOptionSingleton;
import org.jaudiotagger.tag.id3.AbstractID3v2Tag;
import org.jaudiotagger.tag.id3.ID3v24Frame;
import org.jaudiotagger.tag.id3.ID3v24Frames;
import org.jaudiotagger.tag.id3.ID3v24Tag;
import org.jaudiotagger.tag.id3.framebody.FrameBodyAPIC;
import org.jaudiotagger.tag.id3.framebody.FrameBodyCOMM;
import org.jaudiotagger.tag.id3.framebody.FrameBodyTPE1;
import org.jaudiotagger.tag.id3.valuepair.TextEncoding;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * MP3 (ID3v2) 标签写入
 *
 * 已有的 ID3v2.2 / v2.3 标签会转换为 v2.4 处理，保存时统一写出 v2.4。
 * 注释和封面描述固定使用 ISO-8859-1 编码，注释语言固定为 "XXX"。
 */
@Slf4j
public class Mp3Tagger implements AudioTagger {

    static final String COMMENT_LANGUAGE = "XXX";

    private final File file;
    private final TaggerConfig config;

    private MP3File mp3File;
    private ID3v24Tag tag;

    public Mp3Tagger(File file, TaggerConfig config) throws TaggingException {
        this.file = file;
        this.config = config;

        try {
            this.mp3File = new MP3File(file);
        } catch (IOException | ReadOnlyFileException e) {
            throw new TagIoException("failed to open mp3 file: " + file.getAbsolutePath(), e);
        } catch (TagException | CannotReadException | InvalidAudioFrameException e) {
            throw new TagParseException("failed to parse mp3 file: " + file.getAbsolutePath(), e);
        } catch (RuntimeException e) {
            throw new TagParseException("malformed mp3 tag: " + file.getAbsolutePath(), e);
        }

        if (mp3File.hasID3v2Tag()) {
            AbstractID3v2Tag existing = mp3File.getID3v2Tag();
            this.tag = existing instanceof ID3v24Tag ? (ID3v24Tag) existing : new ID3v24Tag(existing);
            log.info("Opened mp3 {} (existing {} tag)", file.getName(), existing.getClass().getSimpleName());
        } else {
            this.tag = new ID3v24Tag();
            log.info("Opened mp3 {} (no ID3v2 tag, creating one)", file.getName());
        }
    }

    @Override
    public void setCover(byte[] imageData, String mimeType) throws TaggingException {
        TagValues.requireCover(imageData, mimeType);
        addPicture(CoverArt.embedded(imageData, mimeType));
    }

    @Override
    public void setCoverUrl(String coverUrl) throws TaggingException {
        TagValues.requireCoverUrl(coverUrl);
        addPicture(CoverArt.linked(coverUrl));
    }

    private void addPicture(CoverArt cover) throws TaggingException {
        FrameBodyAPIC body = new FrameBodyAPIC(TextEncoding.ISO_8859_1, cover.getMimeType(),
            (byte) CoverArt.PICTURE_TYPE_FRONT_COVER, config.getCoverDescription(), cover.getPayload());
        ID3v24Frame frame = new ID3v24Frame(ID3v24Frames.FRAME_ID_ATTACHED_PICTURE);
        frame.setBody(body);
        try {
            // addField 追加到已有 APIC 列表，不替换
            tag.addField(frame);
        } catch (FieldDataInvalidException e) {
            throw new TaggingException("failed to add picture frame to " + file.getName(), e);
        }
        log.debug("Added APIC frame: {}", cover);
    }

    @Override
    public void setTitle(String title) throws TaggingException {
        setTextIfEmpty(FieldKey.TITLE, title);
    }

    @Override
    public void setAlbum(String album) throws TaggingException {
        setTextIfEmpty(FieldKey.ALBUM, album);
    }

    private void setTextIfEmpty(FieldKey key, String value) throws TaggingException {
        TagValues.requireText(key, value);
        String existing = tag.getFirst(key);
        if (!existing.isEmpty()) {
            log.debug("Keeping existing {}: {}", key, existing);
            return;
        }
        try {
            tag.setField(key, value);
        } catch (FieldDataInvalidException | IllegalArgumentException e) {
            throw new TaggingException("invalid value for " + key + ": " + value, e);
        }
    }

    @Override
    public void setArtist(List<String> artists) throws TaggingException {
        TagValues.requireTexts(FieldKey.ARTIST, artists);
        if (!tag.getFields(FieldKey.ARTIST).isEmpty()) {
            log.debug("Keeping existing artists: {}", tag.getAll(FieldKey.ARTIST));
            return;
        }
        if (artists.isEmpty()) {
            return;
        }

        // v2.4 的多个值写在同一个 TPE1 帧里，读取时重复的 TPE1 帧会被丢弃
        FrameBodyTPE1 body = new FrameBodyTPE1(
            TagOptionSingleton.getInstance().getId3v24DefaultTextEncoding(), artists.get(0));
        for (int i = 1; i < artists.size(); i++) {
            body.addTextValue(artists.get(i));
        }
        ID3v24Frame frame = new ID3v24Frame(ID3v24Frames.FRAME_ID_ARTIST);
        frame.setBody(body);
        try {
            tag.setField(frame);
        } catch (FieldDataInvalidException e) {
            throw new TaggingException("invalid artists: " + artists, e);
        }
    }

    @Override
    public void setComment(String comment) throws TaggingException {
        TagValues.requireText(FieldKey.COMMENT, comment);
        if (!tag.getFields(FieldKey.COMMENT).isEmpty()) {
            log.debug("Keeping existing comment: {}", tag.getFirst(FieldKey.COMMENT));
            return;
        }

        ID3v24Frame frame = new ID3v24Frame(ID3v24Frames.FRAME_ID_COMMENT);
        frame.setBody(new FrameBodyCOMM(TextEncoding.ISO_8859_1, COMMENT_LANGUAGE, "", comment));
        try {
            tag.setField(frame);
        } catch (FieldDataInvalidException e) {
            throw new TaggingException("invalid comment: " + comment, e);
        }
    }

    /**
     * 写回标签并释放会话
     * 写入失败时同样会释放，异常原样抛出
     */
    @Override
    public void save() throws TaggingException {
        try {
            mp3File.setID3v2Tag(tag);
            mp3File.commit();
            log.info("Saved mp3 tag: {}", file.getName());
        } catch (CannotWriteException e) {
            throw new TagIoException("failed to write mp3 tag: " + file.getAbsolutePath(), e);
        } finally {
            release();
        }
    }

    /**
     * save 之后会话即被释放
     */
    boolean isReleased() {
        return mp3File == null;
    }

    private void release() {
        mp3File = null;
        tag = null;
        log.debug("Released mp3 session: {}", file.getName());
    }

    @Override
    public File getFile() {
        return file;
    }

    @Override
    public AudioFormat getFormat() {
        return AudioFormat.MP3;
    }
}
