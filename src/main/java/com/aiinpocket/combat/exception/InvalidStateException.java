package com.aiinpocket.combat.exception;

/** 對非進行中的場次執行行動，或違反場次生命週期的操作 */
public class InvalidStateException extends CombatException {

    public InvalidStateException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "INVALID_STATE";
    }
}
