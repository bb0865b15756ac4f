package com.lux032.tagmerger.tagger;

import com.lux032.tagmerger.config.TaggerConfig;
import com.lux032.tagmerger.exception.PictureEncodeException;
import com.lux032.tagmerger.exception.TagIoException;
import com.lux032.tagmerger.exception.TaggingException;
import com.lux032.tagmerger.model.CoverArt;
import org.jaudiotagger.audio.mp3.MP3File;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.TagField;
import org.jaudiotagger.tag.id3.AbstractID3v2Frame;
import org.jaudiotagger.tag.id3.AbstractID3v2Tag;
import org.jaudiotagger.tag.id3.ID3v23Tag;
import org.jaudiotagger.tag.id3.ID3v24Tag;
import org.jaudiotagger.tag.id3.framebody.FrameBodyAPIC;
import org.jaudiotagger.tag.id3.framebody.FrameBodyCOMM;
import org.jaudiotagger.tag.id3.valuepair.TextEncoding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class Mp3TaggerTest {

    @TempDir
    Path tempDir;

    private TaggerConfig config;
    private Path mp3;

    @BeforeEach
    void setUp() throws Exception {
        config = new TaggerConfig();
        mp3 = AudioFixtures.mp3(tempDir, "track.mp3");
    }

    private Mp3Tagger open() throws Exception {
        return new Mp3Tagger(mp3.toFile(), config);
    }

    private void preTag(AbstractID3v2Tag tag) throws Exception {
        MP3File file = new MP3File(mp3.toFile());
        file.setID3v2Tag(tag);
        file.commit();
    }

    private static FrameBodyAPIC pictureBody(TagField field) {
        return (FrameBodyAPIC) ((AbstractID3v2Frame) field).getBody();
    }

    @Test
    void title_first_write_wins() throws Exception {
        Mp3Tagger tagger = open();
        tagger.setTitle("x");
        tagger.setTitle("x");
        tagger.setTitle("y");
        tagger.save();

        AbstractID3v2Tag tag = AudioFixtures.readId3v2(mp3);
        assertThat(tag.getFields(FieldKey.TITLE)).hasSize(1);
        assertThat(tag.getFirst(FieldKey.TITLE)).isEqualTo("x");
    }

    @Test
    void existing_title_and_album_are_kept() throws Exception {
        ID3v24Tag existing = new ID3v24Tag();
        existing.setField(FieldKey.TITLE, "Original");
        existing.setField(FieldKey.ALBUM, "Original Album");
        preTag(existing);

        Mp3Tagger tagger = open();
        tagger.setTitle("New");
        tagger.setAlbum("New Album");
        tagger.save();

        AbstractID3v2Tag tag = AudioFixtures.readId3v2(mp3);
        assertThat(tag.getFirst(FieldKey.TITLE)).isEqualTo("Original");
        assertThat(tag.getFirst(FieldKey.ALBUM)).isEqualTo("Original Album");
    }

    @Test
    void id3v23_tag_is_merged_and_written_as_v24() throws Exception {
        ID3v23Tag existing = new ID3v23Tag();
        existing.setField(FieldKey.TITLE, "Old");
        preTag(existing);

        Mp3Tagger tagger = open();
        tagger.setTitle("New");
        tagger.setAlbum("Album");
        tagger.save();

        AbstractID3v2Tag tag = AudioFixtures.readId3v2(mp3);
        assertThat(tag).isInstanceOf(ID3v24Tag.class);
        assertThat(tag.getFirst(FieldKey.TITLE)).isEqualTo("Old");
        assertThat(tag.getFirst(FieldKey.ALBUM)).isEqualTo("Album");
    }

    @Test
    void artists_are_written_in_order() throws Exception {
        Mp3Tagger tagger = open();
        tagger.setArtist(List.of("A", "B", "C"));
        tagger.save();

        assertThat(AudioFixtures.readId3v2(mp3).getAll(FieldKey.ARTIST)).containsExactly("A", "B", "C");
    }

    @Test
    void existing_artist_blocks_new_artists() throws Exception {
        ID3v24Tag existing = new ID3v24Tag();
        existing.setField(FieldKey.ARTIST, "Someone");
        preTag(existing);

        Mp3Tagger tagger = open();
        tagger.setArtist(List.of("A", "B"));
        tagger.save();

        assertThat(AudioFixtures.readId3v2(mp3).getAll(FieldKey.ARTIST)).containsExactly("Someone");
    }

    @Test
    void comment_uses_legacy_encoding_and_xxx_language() throws Exception {
        Mp3Tagger tagger = open();
        tagger.setComment("hello");
        tagger.setComment("ignored");
        tagger.save();

        AbstractID3v2Tag tag = AudioFixtures.readId3v2(mp3);
        List<TagField> comments = tag.getFields(FieldKey.COMMENT);
        assertThat(comments).hasSize(1);

        FrameBodyCOMM body = (FrameBodyCOMM) ((AbstractID3v2Frame) comments.get(0)).getBody();
        assertThat(body.getText()).isEqualTo("hello");
        assertThat(body.getLanguage()).isEqualToIgnoringCase("XXX");
        assertThat(body.getDescription()).isEmpty();
        assertThat(body.getTextEncoding()).isEqualTo(TextEncoding.ISO_8859_1);
    }

    @Test
    void cover_url_is_stored_with_sentinel_mime() throws Exception {
        Mp3Tagger tagger = open();
        tagger.setCoverUrl("https://x/y.jpg");
        tagger.save();

        List<TagField> pictures = AudioFixtures.readId3v2(mp3).getFields(FieldKey.COVER_ART);
        assertThat(pictures).hasSize(1);

        FrameBodyAPIC body = pictureBody(pictures.get(0));
        assertThat(body.getMimeType()).isEqualTo(CoverArt.URL_MIME_SENTINEL);
        assertThat(new String(body.getImageData(), StandardCharsets.UTF_8)).isEqualTo("https://x/y.jpg");
        assertThat(body.getPictureType()).isEqualTo(CoverArt.PICTURE_TYPE_FRONT_COVER);
        assertThat(body.getDescription()).isEqualTo("Front cover");
    }

    @Test
    void every_cover_call_appends_a_picture() throws Exception {
        byte[] image = AudioFixtures.png(2, 2);

        Mp3Tagger tagger = open();
        tagger.setCover(image, CoverArt.MIME_PNG);
        tagger.setCover(image, CoverArt.MIME_PNG);
        tagger.save();

        List<TagField> pictures = AudioFixtures.readId3v2(mp3).getFields(FieldKey.COVER_ART);
        assertThat(pictures).hasSize(2);
        for (TagField picture : pictures) {
            assertThat(pictureBody(picture).getMimeType()).isEqualTo(CoverArt.MIME_PNG);
            assertThat(pictureBody(picture).getImageData()).containsExactly(image);
        }
    }

    @Test
    void cover_description_comes_from_config() throws Exception {
        config.setCoverDescription("Cover");

        Mp3Tagger tagger = open();
        tagger.setCoverUrl("https://x/y.jpg");
        tagger.save();

        TagField picture = AudioFixtures.readId3v2(mp3).getFields(FieldKey.COVER_ART).get(0);
        assertThat(pictureBody(picture).getDescription()).isEqualTo("Cover");
    }

    @Test
    void nothing_is_written_without_save() throws Exception {
        byte[] before = Files.readAllBytes(mp3);

        Mp3Tagger tagger = open();
        tagger.setTitle("Unsaved");
        tagger.setCoverUrl("https://x/y.jpg");

        assertThat(Files.readAllBytes(mp3)).containsExactly(before);
    }

    @Test
    void audio_frames_survive_save() throws Exception {
        long sizeBefore = Files.size(mp3);

        Mp3Tagger tagger = open();
        tagger.setTitle("x");
        tagger.save();

        MP3File reread = new MP3File(mp3.toFile());
        assertThat(reread.getMP3AudioHeader().getMp3StartByte()).isGreaterThan(0);
        assertThat(Files.size(mp3) - reread.getMP3AudioHeader().getMp3StartByte()).isEqualTo(sizeBefore);
    }

    @Test
    void format_is_mp3() throws Exception {
        Mp3Tagger tagger = open();
        assertThat(tagger.getFormat()).isEqualTo(AudioFormat.MP3);
        assertThat(tagger.getFile()).isEqualTo(mp3.toFile());
    }

    @Test
    void invalid_cover_input_fails_but_session_stays_usable() throws Exception {
        Mp3Tagger tagger = open();
        assertThatThrownBy(() -> tagger.setCover(new byte[]{1, 2, 3}, null))
            .isInstanceOf(PictureEncodeException.class);
        assertThatThrownBy(() -> tagger.setCover(null, CoverArt.MIME_JPEG))
            .isInstanceOf(PictureEncodeException.class);
        assertThatThrownBy(() -> tagger.setCoverUrl(null))
            .isInstanceOf(PictureEncodeException.class);

        tagger.setTitle("Still works");
        tagger.save();

        AbstractID3v2Tag tag = AudioFixtures.readId3v2(mp3);
        assertThat(tag.getFirst(FieldKey.TITLE)).isEqualTo("Still works");
        assertThat(tag.getFields(FieldKey.COVER_ART)).isEmpty();
    }

    @Test
    void null_text_values_are_rejected() throws Exception {
        Mp3Tagger tagger = open();

        assertThatThrownBy(() -> tagger.setTitle(null)).isInstanceOf(TaggingException.class);
        assertThatThrownBy(() -> tagger.setComment(null)).isInstanceOf(TaggingException.class);
        assertThatThrownBy(() -> tagger.setArtist(Arrays.asList("A", null)))
            .isInstanceOf(TaggingException.class)
            .hasMessageContaining("ARTIST");

        tagger.setArtist(List.of("A"));
        tagger.save();
        assertThat(AudioFixtures.readId3v2(mp3).getAll(FieldKey.ARTIST)).containsExactly("A");
    }

    @Test
    void save_releases_session() throws Exception {
        Mp3Tagger tagger = open();
        tagger.setTitle("x");
        assertThat(tagger.isReleased()).isFalse();

        tagger.save();

        assertThat(tagger.isReleased()).isTrue();
    }

    @Test
    void failed_save_is_an_io_error_and_still_releases_session() throws Exception {
        Mp3Tagger tagger = open();
        tagger.setTitle("x");
        Files.delete(mp3);

        assertThatThrownBy(tagger::save).isInstanceOf(TagIoException.class);
        assertThat(tagger.isReleased()).isTrue();
        assertThat(mp3).doesNotExist();
    }
}
