package com.asiainfo.semantic.core.engine;

import com.asiainfo.semantic.core.exception.QueryCancelledException;

import java.time.Duration;

/**
 * 查询取消令牌
 * 支持超时与主动取消；长时间扫描与下钻在循环中周期性检查，取消后抛出 {@link QueryCancelledException}。
 */
public final class CancellationToken {

    /**
     * 永不取消
     */
    public static final CancellationToken NONE = new CancellationToken(0L, false);

    private final long deadlineNanos;
    private final boolean hasDeadline;
    private volatile boolean cancelled;

    private CancellationToken(long deadlineNanos, boolean hasDeadline) {
        this.deadlineNanos = deadlineNanos;
        this.hasDeadline = hasDeadline;
    }

    public static CancellationToken create() {
        return new CancellationToken(0L, false);
    }

    public static CancellationToken withTimeout(Duration timeout) {
        return new CancellationToken(System.nanoTime() + timeout.toNanos(), true);
    }

    public void cancel() {
        if (this == NONE) {
            throw new IllegalStateException("CancellationToken.NONE cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (hasDeadline && System.nanoTime() - deadlineNanos > 0);
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new QueryCancelledException("query cancelled");
        }
        if (hasDeadline && System.nanoTime() - deadlineNanos > 0) {
            throw new QueryCancelledException("query deadline exceeded");
        }
    }
}
