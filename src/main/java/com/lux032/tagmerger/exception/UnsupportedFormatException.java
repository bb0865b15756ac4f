package com.lux032.tagmerger.exception;

import lombok.Getter;

/**
 * 不支持的音频格式
 */
@Getter
public class UnsupportedFormatException extends TaggingException {

    private final String format;

    public UnsupportedFormatException(String format) {
        super("format: " + format + " is not supported");
        this.format = format;
    }
}
