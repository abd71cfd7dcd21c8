package com.aiinpocket.combat.repository;

import com.aiinpocket.combat.model.entity.CurrencyBalance;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface CurrencyBalanceRepository extends JpaRepository<CurrencyBalance, Long> {

    /** 鎖定餘額列（SELECT ... FOR UPDATE），避免並發扣款超支 */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM CurrencyBalance b WHERE b.userId = :userId AND b.currencyCode = :code")
    Optional<CurrencyBalance> findForUpdate(@Param("userId") Long userId, @Param("code") String currencyCode);
}
