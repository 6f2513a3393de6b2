package com.github.lruttl.cache;

import java.util.Objects;

/**
 * 一次 get/peek 的结果
 *
 * isFound() 是唯一可信的判断依据：过期时仍然会带回旧值（stale value）
 * 便于诊断，但 isFound() 为 false，不能当作有效命中使用。
 */
public final class Lookup<V> {
    private static final Lookup<?> ABSENT = new Lookup<>(null, false, false);

    private final V value;
    private final boolean found;
    private final boolean expired;

    private Lookup(V value, boolean found, boolean expired) {
        this.value = value;
        this.found = found;
        this.expired = expired;
    }

    @SuppressWarnings("unchecked")
    public static <V> Lookup<V> absent() {
        return (Lookup<V>) ABSENT;
    }

    public static <V> Lookup<V> hit(V value) {
        return new Lookup<>(value, true, false);
    }

    public static <V> Lookup<V> expired(V staleValue) {
        return new Lookup<>(staleValue, false, true);
    }

    public boolean isFound() {
        return found;
    }

    /** key仍在存储中但已过期 */
    public boolean isExpired() {
        return expired;
    }

    /** 命中时为当前值，过期时为旧值，不存在时为null */
    public V value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Lookup)) return false;
        Lookup<?> other = (Lookup<?>) o;
        return found == other.found && expired == other.expired && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, found, expired);
    }

    @Override
    public String toString() {
        if (found) return "Lookup{hit=" + value + "}";
        if (expired) return "Lookup{expired=" + value + "}";
        return "Lookup{absent}";
    }
}
