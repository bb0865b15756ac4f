package com.lux032.tagmerger.exception;

/**
 * 封面图片数据或 MIME 类型无效。
 * 只影响当前这次封面写入，会话本身仍可继续使用。
 */
public class PictureEncodeException extends TaggingException {

    public PictureEncodeException(String message) {
        super(message);
    }

    public PictureEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
