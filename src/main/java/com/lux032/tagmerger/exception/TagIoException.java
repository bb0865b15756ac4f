package com.lux032.tagmerger.exception;

/**
 * 读取或写回音频文件时发生的 I/O 错误
 */
public class TagIoException extends TaggingException {

    public TagIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
