package com.aiinpocket.combat.service.combat;

import com.aiinpocket.combat.exception.InvalidStateException;
import com.aiinpocket.combat.model.domain.CombatLogEntry;
import com.aiinpocket.combat.model.domain.CombatSession;
import com.aiinpocket.combat.model.domain.EnemySnapshot;
import com.aiinpocket.combat.model.domain.PlayerStats;
import com.aiinpocket.combat.model.enums.CombatAction;
import com.aiinpocket.combat.model.enums.CombatStatus;
import com.aiinpocket.combat.model.enums.HitZone;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.random.RandomGenerator;

/**
 * 回合狀態機。
 *
 * <p>攻擊回合：玩家點擊決定攻擊區域。
 * <ul>
 *   <li>injure：玩家自傷，敵方不受傷也不反擊</li>
 *   <li>其他：敵方擲防禦區域抵銷傷害；若敵方存活，再擲攻擊區域反擊（不經格擋，只扣玩家防禦）</li>
 * </ul>
 * 防禦回合：玩家點擊決定防禦區域，敵方擲攻擊區域，傷害經玩家格擋後扣血。
 * 敵方擲出 injure 時傷到自己。
 *
 * <p>所有輸入驗證都在修改場次之前完成；驗證失敗時場次保持原狀。
 * 呼叫端須持有該場次的鎖。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CombatTurnEngine {

    private final ZoneResolver zoneResolver;
    private final DamageCalculator damageCalculator;
    private final RandomGenerator combatRandom;
    private final Clock combatClock;

    public CombatLogEntry attack(CombatSession session, double tapDegrees) {
        requireOngoing(session);
        PlayerStats player = session.getPlayer();
        EnemySnapshot enemy = session.getEnemy();
        HitZone playerZone = zoneResolver.resolve(tapDegrees, player.weapon(), player.accuracy());

        int toEnemy = 0;
        int toPlayer = 0;
        HitZone enemyDefenseZone = null;
        HitZone enemyAttackZone = null;

        if (playerZone == HitZone.INJURE) {
            toPlayer = damageCalculator.injureSelfDamage(player.atk());
        } else {
            enemyDefenseZone = zoneResolver.roll(enemy.defAccuracy(), combatRandom);
            int incoming = damageCalculator.attackDamage(
                    player.atk(), enemy.def(), playerZone, critBonus(playerZone));
            toEnemy = damageCalculator.applyDefense(incoming, enemyDefenseZone);

            if (session.getEnemyHp() - toEnemy > 0) {
                enemyAttackZone = zoneResolver.roll(enemy.atkAccuracy(), combatRandom);
                if (enemyAttackZone == HitZone.INJURE) {
                    toEnemy += damageCalculator.injureSelfDamage(enemy.atk());
                } else {
                    toPlayer = damageCalculator.attackDamage(
                            enemy.atk(), player.def(), enemyAttackZone, critBonus(enemyAttackZone));
                }
            }
        }

        return applyTurn(session, CombatAction.ATTACK, tapDegrees, playerZone,
                enemyDefenseZone, enemyAttackZone, toEnemy, toPlayer);
    }

    public CombatLogEntry defend(CombatSession session, double tapDegrees) {
        requireOngoing(session);
        PlayerStats player = session.getPlayer();
        EnemySnapshot enemy = session.getEnemy();
        HitZone defenseZone = zoneResolver.resolve(tapDegrees, player.weapon(), player.accuracy());

        int toEnemy = 0;
        int toPlayer = 0;
        HitZone enemyAttackZone = zoneResolver.roll(enemy.atkAccuracy(), combatRandom);
        if (enemyAttackZone == HitZone.INJURE) {
            toEnemy = damageCalculator.injureSelfDamage(enemy.atk());
        } else {
            int incoming = damageCalculator.attackDamage(
                    enemy.atk(), player.def(), enemyAttackZone, critBonus(enemyAttackZone));
            toPlayer = damageCalculator.applyDefense(incoming, defenseZone);
        }

        return applyTurn(session, CombatAction.DEFEND, tapDegrees, defenseZone,
                null, enemyAttackZone, toEnemy, toPlayer);
    }

    private CombatLogEntry applyTurn(CombatSession session, CombatAction action, double tapDegrees,
                                     HitZone playerZone, HitZone enemyDefenseZone, HitZone enemyAttackZone,
                                     int toEnemy, int toPlayer) {
        int playerHp = Math.max(0, session.getPlayerHp() - toPlayer);
        int enemyHp = Math.max(0, session.getEnemyHp() - toEnemy);
        Instant now = combatClock.instant();

        CombatLogEntry entry = new CombatLogEntry(session.getTurnNumber(), action, tapDegrees,
                playerZone, enemyDefenseZone, enemyAttackZone, toEnemy, toPlayer, playerHp, enemyHp, now);

        session.setPlayerHp(playerHp);
        session.setEnemyHp(enemyHp);
        session.getCombatLog().add(entry);
        session.setTurnNumber(session.getTurnNumber() + 1);
        session.setStatus(deriveStatus(playerHp, enemyHp));

        log.debug("[戰鬥] 場次 {} 第 {} 回合 {}: 玩家 {} 敵方攻擊 {} → 敵方 -{} / 玩家 -{}",
                session.getSessionId(), entry.turn(), action, playerZone, enemyAttackZone, toEnemy, toPlayer);
        if (session.getStatus().isTerminal()) {
            log.info("[戰鬥] 場次 {} 於第 {} 回合結束: {}",
                    session.getSessionId(), entry.turn(), session.getStatus());
        }
        return entry;
    }

    static CombatStatus deriveStatus(int playerHp, int enemyHp) {
        if (enemyHp <= 0) return CombatStatus.VICTORY;
        if (playerHp <= 0) return CombatStatus.DEFEAT;
        return CombatStatus.ONGOING;
    }

    private double critBonus(HitZone zone) {
        return zone == HitZone.CRIT ? damageCalculator.rollCritBonus(combatRandom) : 0;
    }

    private static void requireOngoing(CombatSession session) {
        if (!session.isOngoing()) {
            throw new InvalidStateException("戰鬥已結束（" + session.getStatus() + "），無法再行動");
        }
    }
}
