package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.CurrencyTransaction;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CurrencyTransactionRepository extends JpaRepository<CurrencyTransaction, Long> {

    boolean existsByUserIdAndCurrencyCodeAndSourceTypeAndSourceId(
            Long userId, String currencyCode, String sourceType, String sourceId);
}
