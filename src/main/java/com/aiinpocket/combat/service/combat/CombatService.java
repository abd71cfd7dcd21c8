package com.aiinpocket.combat.service.combat;

import com.aiinpocket.combat.config.CombatProperties;
import com.aiinpocket.combat.exception.ExternalDependencyException;
import com.aiinpocket.combat.exception.InvalidStateException;
import com.aiinpocket.combat.exception.NotFoundException;
import com.aiinpocket.combat.exception.ValidationException;
import com.aiinpocket.combat.gateway.PlayerStatsProvider;
import com.aiinpocket.combat.gateway.ProgressionRepository;
import com.aiinpocket.combat.model.domain.*;
import com.aiinpocket.combat.model.dto.SessionSummary;
import com.aiinpocket.combat.model.dto.TurnResult;
import com.aiinpocket.combat.service.combat.session.CombatSessionStore;
import com.aiinpocket.combat.service.combat.session.SessionLockRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BiFunction;

/**
 * 戰鬥核心對外服務。
 * 負責：
 * 1. 開戰：擷取玩家數值、依地點與等級抽出敵人、建立場次（每位玩家同時只能有一場）
 * 2. 攻擊/防禦回合：在場次鎖內推進狀態機並更新 TTL
 * 3. 分出勝負時透過 {@link RewardSettlementService#settle} 結算（與手動領取同一路徑）
 * 4. 放棄戰鬥與場次查詢
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CombatService {

    private final CombatSessionStore sessionStore;
    private final SessionLockRegistry lockRegistry;
    private final CombatTurnEngine turnEngine;
    private final ZoneResolver zoneResolver;
    private final CombatContentProvider contentProvider;
    private final RewardSettlementService settlementService;
    private final PlayerStatsProvider playerStatsProvider;
    private final ProgressionRepository progressionRepository;
    private final CombatProperties props;
    private final Clock combatClock;

    /** 以玩家目前等級開戰 */
    public SessionSummary startCombat(Long userId, String locationId) {
        requireUser(userId);
        int level = progressionRepository.currentLevel(userId);
        int combatLevel = Math.max(props.level().min(), Math.min(props.level().max(), level));
        return startCombat(userId, locationId, combatLevel);
    }

    /**
     * 建立新的戰鬥場次。
     *
     * @throws ValidationException   等級超出範圍或參數缺漏
     * @throws InvalidStateException 玩家已有未結束的場次
     * @throws NotFoundException     地點、玩家或可出現的敵人不存在
     */
    public SessionSummary startCombat(Long userId, String locationId, int combatLevel) {
        requireUser(userId);
        if (locationId == null || locationId.isBlank()) {
            throw new ValidationException("地點不可為空");
        }
        if (combatLevel < props.level().min() || combatLevel > props.level().max()) {
            throw new ValidationException(String.format("戰鬥等級必須介於 %d 與 %d 之間: %d",
                    props.level().min(), props.level().max(), combatLevel));
        }

        return lockRegistry.withLock("user:" + userId, () -> {
            sessionStore.findActiveByUser(userId).ifPresent(existing -> {
                throw new InvalidStateException("已有進行中的戰鬥: " + existing.getSessionId());
            });

            PlayerStats player = playerStatsProvider.getEquippedStats(userId);
            EnemySnapshot enemy = contentProvider.selectEnemy(locationId, combatLevel);
            Instant now = combatClock.instant();

            CombatSession session = CombatSession.builder()
                    .sessionId(UUID.randomUUID().toString())
                    .userId(userId)
                    .locationId(locationId)
                    .combatLevel(combatLevel)
                    .enemy(enemy)
                    .player(player)
                    .playerHp(player.hp())
                    .enemyHp(enemy.hp())
                    .createdAt(now)
                    .build();
            sessionStore.put(session);

            log.info("[戰鬥] 用戶 {} 在 {} 開戰（Lv.{}）→ 遭遇「{}」T{}（風格 {}），場次 {}",
                    userId, locationId, combatLevel, enemy.name(), enemy.tier(), enemy.styleId(),
                    session.getSessionId());
            return summarize(session);
        });
    }

    public TurnResult submitAttack(String sessionId, double tapDegrees) {
        return playTurn(sessionId, tapDegrees, turnEngine::attack);
    }

    public TurnResult submitDefend(String sessionId, double tapDegrees) {
        return playTurn(sessionId, tapDegrees, turnEngine::defend);
    }

    /**
     * 領取獎勵。已結算過的場次回傳相同獎勵。
     */
    public RewardBundle completeCombat(String sessionId) {
        return settlementService.settle(sessionId);
    }

    /**
     * 放棄戰鬥：刪除場次、不發放任何獎勵也不記錄戰績。
     * 已開始結算或已結算的場次不受影響。
     *
     * @throws NotFoundException 場次不存在且從未結算
     */
    public void abandonCombat(String sessionId) {
        lockRegistry.runWithLock(sessionId, () -> {
            Optional<CombatSession> session = sessionStore.find(sessionId);
            if (session.isEmpty()) {
                if (settlementService.isSettled(sessionId)) {
                    log.info("[戰鬥] 場次 {} 已結算，忽略放棄請求", sessionId);
                    return;
                }
                throw new NotFoundException("戰鬥場次", sessionId);
            }
            if (session.get().getSettlementPhase().hasStarted()) {
                log.info("[戰鬥] 場次 {} 已開始結算（{}），忽略放棄請求",
                        sessionId, session.get().getSettlementPhase());
                return;
            }
            sessionStore.delete(sessionId);
            log.info("[戰鬥] 用戶 {} 放棄場次 {}（第 {} 回合，{}）", session.get().getUserId(), sessionId,
                    session.get().getTurnNumber(), session.get().getStatus());
        });
    }

    /** 場次復原檢視 */
    public SessionSummary getSession(String sessionId) {
        return summarize(sessionStore.get(sessionId));
    }

    public Optional<SessionSummary> getActiveSession(Long userId) {
        requireUser(userId);
        return sessionStore.findActiveByUser(userId).map(this::summarize);
    }

    /** 場次（或已結算場次）的擁有者 */
    public Optional<Long> findOwner(String sessionId) {
        Optional<CombatSession> session = sessionStore.find(sessionId);
        if (session.isPresent()) {
            return Optional.of(session.get().getUserId());
        }
        return settlementService.findSettledOwner(sessionId);
    }

    private TurnResult playTurn(String sessionId, double tapDegrees,
                                BiFunction<CombatSession, Double, CombatLogEntry> action) {
        return lockRegistry.withLock(sessionId, () -> {
            CombatSession session = sessionStore.get(sessionId);
            CombatLogEntry entry = action.apply(session, tapDegrees);
            sessionStore.put(session);

            if (!session.getStatus().isTerminal()) {
                return toTurnResult(session, entry, null, false);
            }
            if (!props.settleOnTerminalTurn()) {
                return toTurnResult(session, entry, null, true);
            }
            try {
                RewardBundle rewards = settlementService.settle(sessionId);
                return toTurnResult(session, entry, rewards, false);
            } catch (ExternalDependencyException e) {
                log.warn("[戰鬥] 場次 {} 已分出勝負，但自動結算失敗，等待玩家重新領取: {}",
                        sessionId, e.getMessage());
                return toTurnResult(session, entry, null, true);
            }
        });
    }

    private static TurnResult toTurnResult(CombatSession session, CombatLogEntry entry,
                                           RewardBundle rewards, boolean settlementPending) {
        return new TurnResult(session.getSessionId(), entry, session.getPlayerHp(), session.getEnemyHp(),
                session.getStatus(), rewards, settlementPending);
    }

    private SessionSummary summarize(CombatSession session) {
        PlayerStats player = session.getPlayer();
        return SessionSummary.of(session, zoneResolver.scaleBands(player.weapon(), player.accuracy()));
    }

    private static void requireUser(Long userId) {
        if (userId == null) {
            throw new ValidationException("缺少用戶識別");
        }
    }
}
