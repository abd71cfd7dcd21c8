package com.aiinpocket.combat.gateway;

/**
 * 貨幣帳本。每次異動都會寫入一筆稽核紀錄；同一 (sourceType, sourceId) 只會入帳一次。
 */
public interface CurrencyLedger {

    /**
     * @return 異動後餘額
     * @throws com.aiinpocket.combat.exception.InsufficientFundsException 扣款後餘額為負
     */
    long applyDelta(Long userId, String currencyCode, long amount, String sourceType, String sourceId);
}
