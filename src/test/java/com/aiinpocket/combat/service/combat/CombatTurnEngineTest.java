package com.aiinpocket.combat.service.combat;

import com.aiinpocket.combat.config.CombatProperties;
import com.aiinpocket.combat.exception.InvalidStateException;
import com.aiinpocket.combat.exception.ValidationException;
import com.aiinpocket.combat.model.domain.CombatLogEntry;
import com.aiinpocket.combat.model.domain.CombatSession;
import com.aiinpocket.combat.model.enums.CombatAction;
import com.aiinpocket.combat.model.enums.CombatStatus;
import com.aiinpocket.combat.model.enums.HitZone;
import com.aiinpocket.combat.support.ScriptedRandom;
import com.aiinpocket.combat.support.TestFixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 轉盤預設區域：injure [0,5) miss [5,50) graze [50,110) normal [110,310) crit [310,360)。
 * 玩家 atk 20 / def 5 / hp 100，敵人 atk 10 / def 4，雙方精準度 0。
 */
class CombatTurnEngineTest {

    private final CombatProperties props = TestFixtures.properties();

    private CombatTurnEngine engine(ScriptedRandom random) {
        return new CombatTurnEngine(new ZoneResolver(props), new DamageCalculator(props),
                random, TestFixtures.fixedClock());
    }

    private static CombatSession session(int playerHp, int enemyHp) {
        return CombatSession.builder()
                .sessionId("s-1")
                .userId(42L)
                .locationId("loc-park")
                .combatLevel(5)
                .player(TestFixtures.player())
                .enemy(TestFixtures.enemy(50))
                .playerHp(playerHp)
                .enemyHp(enemyHp)
                .createdAt(TestFixtures.NOW)
                .build();
    }

    @Test
    void critAttackAgainstMissedDefenseThenNormalCounter() {
        // 敵方防禦 18°（miss），暴擊加成 0，反擊 180°（normal）
        ScriptedRandom random = ScriptedRandom.strict(0.05, 0.0, 0.5);
        CombatSession session = session(100, 50);

        CombatLogEntry entry = engine(random).attack(session, 330);

        assertEquals(1, entry.turn());
        assertEquals(CombatAction.ATTACK, entry.action());
        assertEquals(HitZone.CRIT, entry.playerZone());
        assertEquals(HitZone.MISS, entry.enemyDefenseZone());
        assertEquals(HitZone.NORMAL, entry.enemyAttackZone());
        assertEquals(28, entry.damageToEnemy());
        assertEquals(5, entry.damageToPlayer());
        assertEquals(95, session.getPlayerHp());
        assertEquals(22, session.getEnemyHp());
        assertEquals(2, session.getTurnNumber());
        assertEquals(CombatStatus.ONGOING, session.getStatus());
        assertEquals(TestFixtures.NOW, entry.at());
        assertEquals(0, random.remainingDoubles());
    }

    @Test
    void normalAttackIsHalvedByNormalDefense() {
        CombatSession session = session(100, 50);

        CombatLogEntry entry = engine(ScriptedRandom.strict(0.5, 0.5)).attack(session, 300);

        assertEquals(HitZone.NORMAL, entry.playerZone());
        assertEquals(HitZone.NORMAL, entry.enemyDefenseZone());
        assertEquals(8, entry.damageToEnemy());
        assertEquals(42, session.getEnemyHp());
    }

    @Test
    void injureHurtsOnlyThePlayerAndSkipsEnemyRolls() {
        CombatSession session = session(100, 50);

        CombatLogEntry entry = engine(ScriptedRandom.strict()).attack(session, 2);

        assertEquals(HitZone.INJURE, entry.playerZone());
        assertNull(entry.enemyDefenseZone());
        assertNull(entry.enemyAttackZone());
        assertEquals(0, entry.damageToEnemy());
        assertEquals(20, entry.damageToPlayer());
        assertEquals(80, session.getPlayerHp());
        assertEquals(50, session.getEnemyHp());
    }

    @Test
    void selfInjuryCanEndTheFight() {
        CombatSession session = session(10, 50);

        engine(ScriptedRandom.strict()).attack(session, 2);

        assertEquals(0, session.getPlayerHp());
        assertEquals(CombatStatus.DEFEAT, session.getStatus());
    }

    @Test
    void killingBlowSkipsTheCounter() {
        ScriptedRandom random = ScriptedRandom.strict(0.05);
        CombatSession session = session(100, 10);

        CombatLogEntry entry = engine(random).attack(session, 300);

        assertNull(entry.enemyAttackZone());
        assertEquals(0, entry.damageToPlayer());
        assertEquals(0, session.getEnemyHp());
        assertEquals(100, session.getPlayerHp());
        assertEquals(CombatStatus.VICTORY, session.getStatus());
    }

    @Test
    void enemyInjuringItselfOnCounterAddsToItsDamage() {
        // 防禦 180° normal 擋一半（8），反擊 1.8° injure 自傷 10
        CombatSession session = session(100, 50);

        CombatLogEntry entry = engine(ScriptedRandom.strict(0.5, 0.005)).attack(session, 300);

        assertEquals(HitZone.INJURE, entry.enemyAttackZone());
        assertEquals(18, entry.damageToEnemy());
        assertEquals(0, entry.damageToPlayer());
        assertEquals(32, session.getEnemyHp());
    }

    @Test
    void enemySelfInjuryOnCounterCanGiveVictory() {
        CombatSession session = session(100, 9);

        engine(ScriptedRandom.strict(0.5, 0.005)).attack(session, 300);

        assertEquals(0, session.getEnemyHp());
        assertEquals(CombatStatus.VICTORY, session.getStatus());
    }

    @Test
    void grazeDefenseBlocksThirtyPercentOfCrit() {
        // 敵方 324° crit（加成 0）→ 11，graze 格擋 30% → 7
        CombatSession session = session(100, 50);

        CombatLogEntry entry = engine(ScriptedRandom.strict(0.9, 0.0)).defend(session, 60);

        assertEquals(CombatAction.DEFEND, entry.action());
        assertEquals(HitZone.GRAZE, entry.playerZone());
        assertNull(entry.enemyDefenseZone());
        assertEquals(HitZone.CRIT, entry.enemyAttackZone());
        assertEquals(7, entry.damageToPlayer());
        assertEquals(0, entry.damageToEnemy());
        assertEquals(93, session.getPlayerHp());
    }

    @Test
    void lethalDefendTurnIsDefeat() {
        CombatSession session = session(3, 50);

        engine(ScriptedRandom.strict(0.9, 0.0)).defend(session, 60);

        assertEquals(0, session.getPlayerHp());
        assertEquals(CombatStatus.DEFEAT, session.getStatus());
    }

    @Test
    void enemyInjureWhileDefendingHurtsEnemy() {
        CombatSession session = session(100, 50);

        CombatLogEntry entry = engine(ScriptedRandom.strict(0.005)).defend(session, 200);

        assertEquals(HitZone.INJURE, entry.enemyAttackZone());
        assertEquals(10, entry.damageToEnemy());
        assertEquals(0, entry.damageToPlayer());
        assertEquals(40, session.getEnemyHp());
    }

    @Test
    void critDefenseStillLetsOneDamageThrough() {
        // 敵方 normal 5 傷害，crit 格擋 80% → floor(1.0) = 1
        CombatSession session = session(100, 50);

        CombatLogEntry entry = engine(ScriptedRandom.strict(0.5)).defend(session, 330);

        assertEquals(HitZone.CRIT, entry.playerZone());
        assertEquals(1, entry.damageToPlayer());
    }

    @Test
    void invalidTapLeavesSessionUntouched() {
        CombatSession session = session(100, 50);
        CombatTurnEngine engine = engine(ScriptedRandom.strict());

        assertThrows(ValidationException.class, () -> engine.attack(session, 400));
        assertThrows(ValidationException.class, () -> engine.defend(session, -0.1));
        assertThrows(ValidationException.class, () -> engine.attack(session, Double.NaN));

        assertEquals(1, session.getTurnNumber());
        assertEquals(100, session.getPlayerHp());
        assertEquals(50, session.getEnemyHp());
        assertTrue(session.getCombatLog().isEmpty());
    }

    @Test
    void finishedSessionRejectsActions() {
        CombatSession session = session(100, 0);
        session.setStatus(CombatStatus.VICTORY);
        CombatTurnEngine engine = engine(ScriptedRandom.strict());

        assertThrows(InvalidStateException.class, () -> engine.attack(session, 200));
        assertThrows(InvalidStateException.class, () -> engine.defend(session, 200));
    }

    @Test
    void turnsAreNumberedAndLogged() {
        CombatSession session = session(100, 50);
        CombatTurnEngine engine = engine(ScriptedRandom.withFallback(0.5));

        engine.attack(session, 300);
        engine.defend(session, 200);
        engine.attack(session, 300);

        assertEquals(4, session.getTurnNumber());
        assertEquals(3, session.getCombatLog().size());
        assertEquals(CombatAction.DEFEND, session.getCombatLog().get(1).action());
        assertEquals(3, session.getCombatLog().get(2).turn());
        assertEquals(session.getEnemyHp(), session.getCombatLog().get(2).enemyHpAfter());
    }

    @Test
    void enemyDeathIsCheckedBeforePlayerDeath() {
        assertEquals(CombatStatus.VICTORY, CombatTurnEngine.deriveStatus(0, 0));
        assertEquals(CombatStatus.DEFEAT, CombatTurnEngine.deriveStatus(0, 5));
        assertEquals(CombatStatus.ONGOING, CombatTurnEngine.deriveStatus(1, 1));
    }
}
