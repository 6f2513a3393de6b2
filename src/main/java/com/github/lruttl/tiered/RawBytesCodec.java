package com.github.lruttl.tiered;

import com.github.lruttl.error.InvalidTypeException;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;

/**
 * 字节透传编解码器，适用于调用方已经持有序列化数据的场景
 *
 * encode 支持 byte[]、ByteBuffer、ByteArrayOutputStream；
 * decode 支持同样三种类型；其他类型抛出 {@link InvalidTypeException}。
 */
public final class RawBytesCodec implements Codec {
    public static final RawBytesCodec INSTANCE = new RawBytesCodec();

    private RawBytesCodec() {}

    @Override
    public byte[] encode(Object value) {
        if (value instanceof byte[]) {
            return (byte[]) value;
        }
        if (value instanceof ByteBuffer) {
            // duplicate 不改变调用方的 position
            ByteBuffer buf = ((ByteBuffer) value).duplicate();
            byte[] data = new byte[buf.remaining()];
            buf.get(data);
            return data;
        }
        if (value instanceof ByteArrayOutputStream) {
            return ((ByteArrayOutputStream) value).toByteArray();
        }
        throw new InvalidTypeException(value == null ? null : value.getClass());
    }

    @Override
    public <T> T decode(byte[] data, Class<T> type) {
        if (type == byte[].class) {
            return type.cast(data);
        }
        if (type == ByteBuffer.class) {
            return type.cast(ByteBuffer.wrap(data));
        }
        if (type == ByteArrayOutputStream.class) {
            ByteArrayOutputStream out = new ByteArrayOutputStream(data.length);
            out.writeBytes(data);
            return type.cast(out);
        }
        throw new InvalidTypeException(type);
    }
}
