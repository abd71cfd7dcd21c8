package com.aiinpocket.combat.model.dto;

import com.aiinpocket.combat.model.domain.CombatLogEntry;
import com.aiinpocket.combat.model.domain.RewardBundle;
import com.aiinpocket.combat.model.enums.CombatStatus;

/**
 * 單回合結果。
 *
 * @param rewards           本回合分出勝負且已結算時的獎勵，否則為 null
 * @param settlementPending 已分出勝負但獎勵尚未發放（需呼叫 complete 重試）
 */
public record TurnResult(
        String sessionId,
        CombatLogEntry turn,
        int playerHp,
        int enemyHp,
        CombatStatus status,
        RewardBundle rewards,
        boolean settlementPending
) {}
