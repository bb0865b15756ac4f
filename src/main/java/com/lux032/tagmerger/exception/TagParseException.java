package com.lux032.tagmerger.exception;

/**
 * 已有标签或元数据块结构损坏，无法解析
 */
public class TagParseException extends TaggingException {

    public TagParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
