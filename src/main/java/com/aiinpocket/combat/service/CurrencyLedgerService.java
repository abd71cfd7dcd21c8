package com.aiinpocket.combat.service;

import com.aiinpocket.combat.exception.InsufficientFundsException;
import com.aiinpocket.combat.gateway.CurrencyLedger;
import com.aiinpocket.combat.model.entity.CurrencyBalance;
import com.aiinpocket.combat.model.entity.CurrencyTransaction;
import com.aiinpocket.combat.repository.CurrencyBalanceRepository;
import com.aiinpocket.combat.repository.CurrencyTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * 貨幣帳本。
 * 餘額與稽核紀錄在同一交易內寫入；同一來源已入帳時直接回傳目前餘額。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CurrencyLedgerService implements CurrencyLedger {

    private final CurrencyBalanceRepository balanceRepo;
    private final CurrencyTransactionRepository txRepo;

    @Override
    @Transactional
    public long applyDelta(Long userId, String currencyCode, long amount, String sourceType, String sourceId) {
        CurrencyBalance balance = balanceRepo.findForUpdate(userId, currencyCode)
                .orElseGet(() -> balanceRepo.saveAndFlush(CurrencyBalance.builder()
                        .userId(userId)
                        .currencyCode(currencyCode)
                        .build()));

        if (txRepo.existsByUserIdAndCurrencyCodeAndSourceTypeAndSourceId(userId, currencyCode, sourceType, sourceId)) {
            log.info("[貨幣] {}:{} 已入帳過，略過（用戶 {}，{}）", sourceType, sourceId, userId, currencyCode);
            return balance.getBalance();
        }

        long newBalance = balance.getBalance() + amount;
        if (newBalance < 0) {
            throw new InsufficientFundsException(userId, currencyCode, balance.getBalance(), amount);
        }

        balance.setBalance(newBalance);
        balance.setUpdatedAt(Instant.now());
        balanceRepo.save(balance);

        txRepo.save(CurrencyTransaction.builder()
                .userId(userId)
                .currencyCode(currencyCode)
                .amount(amount)
                .balanceAfter(newBalance)
                .sourceType(sourceType)
                .sourceId(sourceId)
                .build());

        log.info("[貨幣] 用戶 {} {} {}{}（{}:{}），餘額 {}",
                userId, currencyCode, amount >= 0 ? "+" : "", amount, sourceType, sourceId, newBalance);
        return newBalance;
    }
}
