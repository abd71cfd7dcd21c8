package com.aiinpocket.combat.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 貨幣異動稽核紀錄。
 * (user, currency, sourceType, sourceId) 唯一，同一來源重複入帳時直接略過。
 */
@Entity
@Table(name = "currency_transaction",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_currency_tx_source",
                columnNames = {"user_id", "currency_code", "source_type", "source_id"}),
        indexes = @Index(name = "idx_currency_tx_user", columnList = "user_id, created_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CurrencyTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "currency_code", nullable = false, length = 20)
    private String currencyCode;

    /** 異動金額（正數入帳、負數扣款） */
    @Column(nullable = false)
    private Long amount;

    @Column(name = "balance_after", nullable = false)
    private Long balanceAfter;

    /** 來源類型，例如 COMBAT_REWARD */
    @Column(name = "source_type", nullable = false, length = 30)
    private String sourceType;

    /** 來源識別碼，例如戰鬥場次 ID */
    @Column(name = "source_id", nullable = false, length = 64)
    private String sourceId;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();
}
