package com.aiinpocket.combat.exception;

/**
 * 戰鬥核心的例外基底類別（unchecked）。
 * 每個子類別帶有固定的錯誤代碼，由 {@code GlobalExceptionHandler} 轉成統一的 JSON 錯誤格式。
 */
public abstract class CombatException extends RuntimeException {

    protected CombatException(String message) {
        super(message);
    }

    protected CombatException(String message, Throwable cause) {
        super(message, cause);
    }

    /** 對外回傳的錯誤代碼 */
    public abstract String getCode();
}
