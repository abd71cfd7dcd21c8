package com.aiinpocket.combat.service.combat;

import com.aiinpocket.combat.config.CombatProperties;
import com.aiinpocket.combat.exception.ExternalDependencyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * 持久層呼叫的重試包裝。
 * 只重試暫時性錯誤（{@link TransientDataAccessException} 或 retryable 的 {@link ExternalDependencyException}），
 * 退避時間以指數成長：initial × 2^(n−1)，上限 maxBackoff。
 */
@Component
@Slf4j
public class TransientRetryExecutor {

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;

    public TransientRetryExecutor(CombatProperties props) {
        this.maxAttempts = Math.max(1, props.retry().maxAttempts());
        this.initialBackoffMs = props.retry().initialBackoff().toMillis();
        this.maxBackoffMs = props.retry().maxBackoff().toMillis();
    }

    public <T> T execute(String operation, Supplier<T> action) {
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!isTransient(e)) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.error("[重試] {} 連續失敗 {} 次，放棄: {}", operation, attempt, e.getMessage());
                    throw e instanceof ExternalDependencyException ede
                            ? ede
                            : new ExternalDependencyException(operation + " 暫時無法完成", e);
                }
                long delay = calculateBackoff(attempt);
                log.warn("[重試] {} 第 {} 次失敗，{}ms 後重試: {}", operation, attempt, delay, e.getMessage());
                sleep(delay, operation, e);
                attempt++;
            }
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    long calculateBackoff(int attempt) {
        long delay = initialBackoffMs * (1L << Math.min(attempt - 1, 6));
        return Math.min(delay, maxBackoffMs);
    }

    private static boolean isTransient(RuntimeException e) {
        if (e instanceof TransientDataAccessException) {
            return true;
        }
        return e instanceof ExternalDependencyException ede && ede.isRetryable();
    }

    private static void sleep(long delayMs, String operation, RuntimeException cause) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ExternalDependencyException(operation + " 重試等待被中斷", cause, false);
        }
    }
}
