package com.poststudio.domain.draft.service;

import com.google.common.util.concurrent.Striped;
import com.poststudio.types.enums.ResponseCode;
import com.poststudio.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * 按草稿 ID 的互斥锁，不同草稿之间互不阻塞（同一分段内的草稿共享一把锁）。
 * 锁可重入，等待超时抛出 CONCURRENT_MODIFICATION。
 */
@Slf4j
@Component
public class DraftLockRegistry {

    private final Striped<Lock> locks;
    private final long lockTimeoutMs;

    public DraftLockRegistry(@Value("${studio.draft.lock-stripes:256}") int stripes,
                             @Value("${studio.draft.lock-timeout-ms:10000}") long lockTimeoutMs) {
        this.locks = Striped.lock(Math.max(1, stripes));
        this.lockTimeoutMs = lockTimeoutMs;
    }

    public <T> T executeLocked(Long draftId, Supplier<T> action) {
        Lock lock = locks.get(draftId);
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AppException(ResponseCode.CONCURRENT_MODIFICATION, "等待草稿锁被中断: " + draftId, ex);
        }
        if (!acquired) {
            log.warn("Draft lock wait timeout. draftId={}, timeoutMs={}", draftId, lockTimeoutMs);
            throw new AppException(ResponseCode.CONCURRENT_MODIFICATION, "草稿正在被修改，请稍后重试: " + draftId);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
