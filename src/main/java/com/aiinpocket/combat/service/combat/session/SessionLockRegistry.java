package com.aiinpocket.combat.service.combat.session;

import com.aiinpocket.combat.exception.InvalidStateException;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 每個場次一把鎖，確保同一場次的攻擊、防禦、結算、放棄依序執行。
 * 鎖以 weak value 保存，沒有執行緒持有時會被回收。
 */
@Component
@Slf4j
public class SessionLockRegistry {

    private static final Duration LOCK_WAIT = Duration.ofSeconds(5);

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock());

    /**
     * 在場次鎖保護下執行任務。
     * 等待超過 5 秒仍拿不到鎖時放棄。
     *
     * @throws InvalidStateException 無法在時限內取得鎖
     */
    public <T> T withLock(String sessionId, Supplier<T> task) {
        ReentrantLock lock = locks.get(sessionId);
        if (!tryAcquire(lock, sessionId)) {
            log.warn("[場次鎖] 場次 {} 仍有動作在處理中，拒絕本次請求", sessionId);
            throw new InvalidStateException("場次正在處理其他動作，請稍後再試");
        }
        try {
            return task.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithLock(String sessionId, Runnable task) {
        withLock(sessionId, () -> {
            task.run();
            return null;
        });
    }

    private static boolean tryAcquire(ReentrantLock lock, String sessionId) {
        try {
            return lock.tryLock(LOCK_WAIT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InvalidStateException("等待場次 " + sessionId + " 的鎖時被中斷");
        }
    }
}
