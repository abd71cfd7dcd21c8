package com.aiinpocket.combat.model.domain;

import com.aiinpocket.combat.model.enums.CombatAction;
import com.aiinpocket.combat.model.enums.HitZone;

import java.time.Instant;

/**
 * 單一回合的戰鬥紀錄。
 *
 * @param playerZone       玩家點擊判定的區域（攻擊回合為攻擊區域，防禦回合為防禦區域）
 * @param enemyDefenseZone 攻擊回合中敵方擲出的防禦區域；玩家 injure 或防禦回合時為 null
 * @param enemyAttackZone  敵方擲出的攻擊區域；敵方未反擊時為 null
 */
public record CombatLogEntry(
        int turn,
        CombatAction action,
        double tapDegrees,
        HitZone playerZone,
        HitZone enemyDefenseZone,
        HitZone enemyAttackZone,
        int damageToEnemy,
        int damageToPlayer,
        int playerHpAfter,
        int enemyHpAfter,
        Instant at
) {}
