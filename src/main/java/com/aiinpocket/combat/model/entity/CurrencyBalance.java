package com.aiinpocket.combat.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "currency_balance",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_currency_balance",
                columnNames = {"user_id", "currency_code"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CurrencyBalance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    /** 貨幣代碼（GOLD / GEMS） */
    @Column(name = "currency_code", nullable = false, length = 20)
    private String currencyCode;

    @Column(nullable = false)
    @Builder.Default
    private Long balance = 0L;

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private Instant updatedAt = Instant.now();
}
