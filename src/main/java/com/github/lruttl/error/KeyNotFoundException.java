package com.github.lruttl.error;

/**
 * 慢速存储中不存在该key。
 * SlowStore 实现可以抛出此异常表示"未找到"，TieredCache 配置 notFoundError 后
 * 可通过 getIgnoreNotFound 将其转换为空结果。
 */
public class KeyNotFoundException extends CacheException {

    private final String key;

    public KeyNotFoundException(String key) {
        super("not found: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
