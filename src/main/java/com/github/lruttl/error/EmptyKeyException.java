package com.github.lruttl.error;

/**
 * 二级缓存的原始key为空，任何一层缓存都不会被访问
 */
public class EmptyKeyException extends CacheException {

    public EmptyKeyException() {
        super("key is empty");
    }
}
