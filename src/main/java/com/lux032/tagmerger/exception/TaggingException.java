package com.lux032.tagmerger.exception;

/**
 * 标签写入相关异常的基类
 */
public class TaggingException extends Exception {

    public TaggingException(String message) {
        super(message);
    }

    public TaggingException(String message, Throwable cause) {
        super(message, cause);
    }
}
