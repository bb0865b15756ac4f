package com.lux032.tagmerger.tagger;

import com.lux032.tagmerger.config.TaggerConfig;
import com.lux032.tagmerger.exception.TagIoException;
import com.lux032.tagmerger.exception.TagParseException;
import com.lux032.tagmerger.exception.TaggingException;
import com.lux032.tagmerger.model.CoverArt;
import com.lux032.tagmerger.util.ImageUtils;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.exceptions.CannotReadException;
import org.jaudiotagger.audio.exceptions.CannotWriteException;
import org.jaudiotagger.audio.exceptions.InvalidAudioFrameException;
import org.jaudiotagger.audio.exceptions.ReadOnlyFileException;
import org.jaudiotagger.audio.flac.FlacFileReader;
import org.jaudiotagger.audio.flac.FlacFileWriter;
import org.jaudiotagger.audio.flac.metadatablock.MetadataBlockDataPicture;
import org.jaudiotagger.tag.FieldDataInvalidException;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.TagException;
import org.jaudiotagger.tag.flac.FlacTag;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * FLAC (Vorbis comment + PICTURE 块) 标签写入
 *
 * 文本字段写入 Vorbis comment 块，封面每次追加一个 PICTURE 块。
 * 注释字段不在此处处理，setComment 直接忽略。
 */
@Slf4j
public class FlacTagger implements AudioTagger {

    private final File file;
    private final TaggerConfig config;
    private final AudioFile audioFile;
    private final FlacTag tag;

    public FlacTagger(File file, TaggerConfig config) throws TaggingException {
        this.file = file;
        this.config = config;

        try {
            this.audioFile = new FlacFileReader().read(file);
        } catch (IOException | ReadOnlyFileException e) {
            throw new TagIoException("failed to open flac file: " + file.getAbsolutePath(), e);
        } catch (CannotReadException | TagException | InvalidAudioFrameException e) {
            throw new TagParseException("failed to parse flac metadata: " + file.getAbsolutePath(), e);
        } catch (RuntimeException e) {
            // comment 块长度与声明的条目数不符时，读取器抛出的是运行时异常
            throw new TagParseException("malformed flac metadata block: " + file.getAbsolutePath(), e);
        }

        // 没有 comment 块时读取器会给出一个空的 Vorbis 标签
        this.tag = (FlacTag) audioFile.getTag();
        if (tag.getVorbisCommentTag().isEmpty()) {
            log.info("Opened flac {} (empty comment block, {} pictures)", file.getName(), tag.getImages().size());
        } else {
            log.info("Opened flac {} ({} pictures)", file.getName(), tag.getImages().size());
        }
    }

    @Override
    public void setCover(byte[] imageData, String mimeType) throws TaggingException {
        TagValues.requireCover(imageData, mimeType);
        ImageUtils.ImageInfo info = ImageUtils.inspect(imageData, mimeType);
        addPicture(new MetadataBlockDataPicture(imageData, CoverArt.PICTURE_TYPE_FRONT_COVER, mimeType,
            config.getCoverDescription(), info.getWidth(), info.getHeight(), info.getColourDepth(), 0));
    }

    @Override
    public void setCoverUrl(String coverUrl) throws TaggingException {
        TagValues.requireCoverUrl(coverUrl);
        CoverArt cover = CoverArt.linked(coverUrl);
        addPicture(new MetadataBlockDataPicture(cover.getPayload(), CoverArt.PICTURE_TYPE_FRONT_COVER,
            cover.getMimeType(), config.getCoverDescription(), 0, 0, 0, 0));
    }

    private void addPicture(MetadataBlockDataPicture picture) throws TaggingException {
        try {
            // FlacTag 把 PICTURE 块单独存放，不会进入 comment 块
            tag.addField(picture);
        } catch (FieldDataInvalidException e) {
            throw new TaggingException("failed to add picture block to " + file.getName(), e);
        }
        log.debug("Added PICTURE block: mime={}, {} bytes", picture.getMimeType(), picture.getImageData().length);
    }

    @Override
    public void setTitle(String title) throws TaggingException {
        addIfAbsent(FieldKey.TITLE, List.of(TagValues.requireText(FieldKey.TITLE, title)));
    }

    @Override
    public void setAlbum(String album) throws TaggingException {
        addIfAbsent(FieldKey.ALBUM, List.of(TagValues.requireText(FieldKey.ALBUM, album)));
    }

    @Override
    public void setArtist(List<String> artists) throws TaggingException {
        addIfAbsent(FieldKey.ARTIST, TagValues.requireTexts(FieldKey.ARTIST, artists));
    }

    /**
     * 该键至少有一个值即视为已存在
     */
    private void addIfAbsent(FieldKey key, List<String> values) throws TaggingException {
        if (!tag.getFields(key).isEmpty()) {
            log.debug("Keeping existing {}: {}", key, tag.getAll(key));
            return;
        }
        try {
            for (String value : values) {
                tag.addField(key, value);
            }
        } catch (FieldDataInvalidException | IllegalArgumentException e) {
            throw new TaggingException("invalid value for " + key + ": " + values, e);
        }
    }

    @Override
    public void setComment(String comment) {
        // FLAC 不写注释
    }

    @Override
    public void save() throws TaggingException {
        try {
            new FlacFileWriter().write(audioFile);
            log.info("Saved flac tag: {}", file.getName());
        } catch (CannotWriteException e) {
            throw new TagIoException("failed to write flac metadata: " + file.getAbsolutePath(), e);
        }
    }

    @Override
    public File getFile() {
        return file;
    }

    @Override
    public AudioFormat getFormat() {
        return AudioFormat.FLAC;
    }
}
