package com.aiinpocket.combat.exception;

import lombok.Getter;

/**
 * 持久層或外部服務失敗。
 * {@code retryable = true} 表示可以安全重試（所有結算步驟皆為冪等或 upsert）。
 */
@Getter
public class ExternalDependencyException extends CombatException {

    private final boolean retryable;

    public ExternalDependencyException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public ExternalDependencyException(String message, Throwable cause) {
        this(message, cause, true);
    }

    @Override
    public String getCode() {
        return "EXTERNAL_DEPENDENCY_ERROR";
    }
}
