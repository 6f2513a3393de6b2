package com.github.lruttl.error;

/**
 * 编解码器不支持的目标类型（例如 RawBytesCodec 只接受 byte[] 与 ByteBuffer）
 */
public class InvalidTypeException extends CacheException {

    private final Class<?> type;

    public InvalidTypeException(Class<?> type) {
        super("invalid type: " + (type == null ? "null" : type.getName()));
        this.type = type;
    }

    public Class<?> getType() {
        return type;
    }
}
