package com.github.lruttl.tiered;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * 调用上下文：截止时间 + 取消标记，由调用方创建并原样传递给 {@link SlowStore}。
 *
 * 缓存核心本身不阻塞、不设置超时，超时与取消完全由慢速存储实现负责检查，
 * 避免一个卡住的远程调用拖住近端缓存。
 *
 * 派生的上下文继承父上下文的取消状态，截止时间取两者中较早的一个。
 */
public final class CallContext {
    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final CallContext parent;
    private final long deadlineNanos; // System.nanoTime() 刻度
    private volatile boolean cancelled;

    private CallContext(CallContext parent, long deadlineNanos) {
        this.parent = parent;
        this.deadlineNanos = deadlineNanos;
    }

    /** 无截止时间的根上下文 */
    public static CallContext background() {
        return new CallContext(null, NO_DEADLINE);
    }

    public static CallContext withTimeout(Duration timeout) {
        return background().childWithTimeout(timeout);
    }

    /** 派生一个可独立取消的子上下文 */
    public CallContext child() {
        return new CallContext(this, deadlineNanos);
    }

    public CallContext childWithTimeout(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        if (hasDeadline() && deadlineNanos - deadline < 0) {
            deadline = deadlineNanos;
        }
        return new CallContext(this, deadline);
    }

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (parent != null && parent.isCancelled());
    }

    public boolean hasDeadline() {
        return deadlineNanos != NO_DEADLINE;
    }

    public boolean isDeadlineExceeded() {
        return hasDeadline() && deadlineNanos - System.nanoTime() <= 0;
    }

    public boolean isDone() {
        return isCancelled() || isDeadlineExceeded();
    }

    /** 距离截止时间的剩余时长；无截止时间返回 empty */
    public Optional<Duration> remaining() {
        if (!hasDeadline()) {
            return Optional.empty();
        }
        long left = deadlineNanos - System.nanoTime();
        return Optional.of(Duration.ofNanos(Math.max(0, left)));
    }

    /**
     * 已取消或已超时则抛出 CancellationException，
     * 供 SlowStore 实现在发起I/O前检查
     */
    public void checkActive() {
        if (isCancelled()) {
            throw new CancellationException("context cancelled");
        }
        if (isDeadlineExceeded()) {
            throw new CancellationException("context deadline exceeded");
        }
    }
}
