package com.github.lruttl.error;

/**
 * 构造参数非法：容量、默认TTL、分片数不满足约束时在 build() 阶段抛出。
 * 不做任何静默修正，对象不会被创建。
 */
public class InvalidCacheConfigException extends IllegalArgumentException {

    public InvalidCacheConfigException(String message) {
        super(message);
    }
}
