package com.aiinpocket.combat.exception;

/** 輸入值超出範圍或格式錯誤，在任何狀態變更之前拋出 */
public class ValidationException extends CombatException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "VALIDATION_ERROR";
    }
}
