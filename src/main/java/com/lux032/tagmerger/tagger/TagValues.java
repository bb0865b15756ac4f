package com.lux032.tagmerger.tagger;

import com.lux032.tagmerger.exception.PictureEncodeException;
import com.lux032.tagmerger.exception.TaggingException;
import org.jaudiotagger.tag.FieldKey;

import java.util.List;

/**
 * setter 入参检查，两种格式共用
 */
final class TagValues {

    private TagValues() {
    }

    static String requireText(FieldKey key, String value) throws TaggingException {
        if (value == null) {
            throw new TaggingException("value for " + key + " must not be null");
        }
        return value;
    }

    static List<String> requireTexts(FieldKey key, List<String> values) throws TaggingException {
        if (values == null) {
            throw new TaggingException("values for " + key + " must not be null");
        }
        for (String value : values) {
            requireText(key, value);
        }
        return values;
    }

    static void requireCover(byte[] imageData, String mimeType) throws PictureEncodeException {
        if (mimeType == null || mimeType.trim().isEmpty()) {
            throw new PictureEncodeException("picture MIME type is missing");
        }
        if (imageData == null || imageData.length == 0) {
            throw new PictureEncodeException("picture data is empty");
        }
    }

    static void requireCoverUrl(String coverUrl) throws PictureEncodeException {
        if (coverUrl == null) {
            throw new PictureEncodeException("cover url must not be null");
        }
    }
}
