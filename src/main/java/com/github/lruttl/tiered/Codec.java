package com.github.lruttl.tiered;

/**
 * 值与字节之间的转换
 */
public interface Codec {

    byte[] encode(Object value);

    <T> T decode(byte[] data, Class<T> type);
}
