package com.github.lruttl.error;

/**
 * 缓存库异常基类（全部为非受检异常）
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
