package com.github.lruttl.error;

/**
 * 序列化/反序列化失败
 */
public class CodecException extends CacheException {

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
