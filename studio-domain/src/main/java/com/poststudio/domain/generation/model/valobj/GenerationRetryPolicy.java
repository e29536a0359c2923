package com.poststudio.domain.generation.model.valobj;

import com.poststudio.domain.generation.adapter.gateway.TransientGenerationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * 生成调用的重试策略：最大次数、退避序列、单次超时、可重试判定。
 */
public final class GenerationRetryPolicy {

    /**
     * 超时与 TransientGenerationException（沿 cause 链查找）视为可重试
     */
    public static final Predicate<Throwable> DEFAULT_RETRYABLE = throwable ->
            hasCause(throwable, TimeoutException.class) || hasCause(throwable, TransientGenerationException.class);

    private final int maxAttempts;
    private final List<Long> backoffScheduleMs;
    private final long callTimeoutMs;
    private final Predicate<Throwable> retryablePredicate;

    public GenerationRetryPolicy(int maxAttempts,
                                 List<Long> backoffScheduleMs,
                                 long callTimeoutMs,
                                 Predicate<Throwable> retryablePredicate) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoffScheduleMs = backoffScheduleMs == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(backoffScheduleMs));
        this.callTimeoutMs = callTimeoutMs;
        this.retryablePredicate = retryablePredicate == null ? DEFAULT_RETRYABLE : retryablePredicate;
    }

    public static GenerationRetryPolicy defaults() {
        return new GenerationRetryPolicy(3, List.of(500L, 1000L), 30_000L, DEFAULT_RETRYABLE);
    }

    public boolean isRetryable(Throwable throwable) {
        return throwable != null && retryablePredicate.test(throwable);
    }

    /**
     * 第 failedAttempt 次失败后的等待时间，序列用尽后沿用最后一个值。
     */
    public long backoffMsAfter(int failedAttempt) {
        if (backoffScheduleMs.isEmpty() || failedAttempt < 1) {
            return 0L;
        }
        int index = Math.min(failedAttempt - 1, backoffScheduleMs.size() - 1);
        Long value = backoffScheduleMs.get(index);
        return value == null ? 0L : Math.max(0L, value);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public List<Long> getBackoffScheduleMs() {
        return backoffScheduleMs;
    }

    public long getCallTimeoutMs() {
        return callTimeoutMs;
    }

    public static boolean hasCause(Throwable throwable, Class<? extends Throwable> type) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (type.isInstance(cursor)) {
                return true;
            }
            cursor = cursor.getCause();
        }
        return false;
    }
}
