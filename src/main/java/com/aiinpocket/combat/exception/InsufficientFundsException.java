package com.aiinpocket.combat.exception;

/** 貨幣扣款後餘額將為負數（僅發生於扣款路徑，獎勵發放不會觸發） */
public class InsufficientFundsException extends CombatException {

    public InsufficientFundsException(Long userId, String currencyCode, long balance, long amount) {
        super(String.format("用戶 %d 的 %s 餘額不足（餘額 %d，異動 %d）", userId, currencyCode, balance, amount));
    }

    @Override
    public String getCode() {
        return "INSUFFICIENT_FUNDS";
    }
}
