package com.aiinpocket.combat.service.combat;

import com.aiinpocket.combat.config.CombatProperties;
import com.aiinpocket.combat.exception.ExternalDependencyException;
import com.aiinpocket.combat.exception.InvalidStateException;
import com.aiinpocket.combat.exception.NotFoundException;
import com.aiinpocket.combat.exception.ValidationException;
import com.aiinpocket.combat.gateway.*;
import com.aiinpocket.combat.model.domain.*;
import com.aiinpocket.combat.model.dto.LevelUpResult;
import com.aiinpocket.combat.model.entity.CombatSettlement;
import com.aiinpocket.combat.model.enums.CombatStatus;
import com.aiinpocket.combat.model.enums.SettlementPhase;
import com.aiinpocket.combat.repository.CombatSettlementRepository;
import com.aiinpocket.combat.service.combat.session.CombatSessionStore;
import com.aiinpocket.combat.service.combat.session.SessionLockRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 獎勵結算（唯一的結算入口）。
 *
 * <p>流程：
 * <ol>
 *   <li>已有結算標記 → 直接回傳當時的獎勵</li>
 *   <li>場次必須已分出勝負，並原子性地標記為結算中</li>
 *   <li>第一次結算時擲出獎勵並存在場次上，重試沿用同一份</li>
 *   <li>依序發放：素材 → 物品 → 金幣 → 經驗值 → 戰績，每完成一步就記入場次的發放日誌</li>
 *   <li>寫入結算標記，最後才刪除場次</li>
 * </ol>
 * 任一步失敗時場次保留並標記 FAILED，已完成的步驟不會重複發放，可安全重試。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RewardSettlementService {

    static final String GOLD = "GOLD";
    static final String SOURCE_COMBAT = "COMBAT_REWARD";

    private final CombatSessionStore sessionStore;
    private final SessionLockRegistry lockRegistry;
    private final CombatSettlementRepository settlementRepo;
    private final CombatContentProvider contentProvider;
    private final MaterialRepository materialRepository;
    private final ItemRepository itemRepository;
    private final CurrencyLedger currencyLedger;
    private final ProgressionRepository progressionRepository;
    private final CombatHistoryRepository historyRepository;
    private final TransientRetryExecutor retryExecutor;
    private final ObjectMapper objectMapper;
    private final CombatProperties props;

    /**
     * 結算場次並回傳獎勵。重複呼叫回傳相同結果。
     *
     * @throws NotFoundException           場次不存在且沒有結算紀錄
     * @throws InvalidStateException       戰鬥尚未分出勝負
     * @throws ExternalDependencyException 發放途中失敗（獎勵可能已部分發放，可安全重試）
     */
    public RewardBundle settle(String sessionId) {
        return lockRegistry.withLock(sessionId, () -> settleLocked(sessionId));
    }

    /** 該場次是否已有結算標記 */
    public boolean isSettled(String sessionId) {
        return settlementRepo.existsBySessionId(sessionId);
    }

    /** 已結算場次的擁有者 */
    public Optional<Long> findSettledOwner(String sessionId) {
        return settlementRepo.findBySessionId(sessionId).map(CombatSettlement::getUserId);
    }

    private RewardBundle settleLocked(String sessionId) {
        Optional<RewardBundle> settled = findSettled(sessionId);
        if (settled.isPresent()) {
            log.info("[結算] 場次 {} 已結算過，回傳既有獎勵", sessionId);
            sessionStore.delete(sessionId);
            return settled.get();
        }

        CombatSession session = sessionStore.get(sessionId);
        if (!session.getStatus().isTerminal()) {
            throw new InvalidStateException("戰鬥尚未結束，無法結算");
        }
        if (!sessionStore.beginSettlement(sessionId)) {
            throw new InvalidStateException("場次正在結算中");
        }

        try {
            RewardBundle bundle = session.getPendingRewards();
            if (bundle == null) {
                bundle = buildBundle(session);
                session.setPendingRewards(bundle);
                sessionStore.put(session);
            }

            bundle = applyGrants(session, bundle);
            saveMarker(session, bundle);
            sessionStore.delete(sessionId);

            log.info("[結算] 場次 {} 完成: {} 金幣 {} 經驗 {} 素材 {} 種 物品 {} 件",
                    sessionId, bundle.outcome(), bundle.gold(), bundle.experience(),
                    bundle.materials().size(), bundle.items().size());
            return bundle;
        } catch (RuntimeException e) {
            session.setSettlementPhase(SettlementPhase.FAILED);
            sessionStore.put(session);
            log.error("[結算] 場次 {} 結算失敗，已完成步驟 {}", sessionId, session.getCompletedGrants(), e);
            throw new ExternalDependencyException("獎勵可能已部分發放，可安全重試", e, isRetryable(e));
        }
    }

    RewardBundle buildBundle(CombatSession session) {
        if (session.getStatus() == CombatStatus.DEFEAT) {
            return RewardBundle.defeat();
        }
        EnemySnapshot enemy = session.getEnemy();
        int level = session.getCombatLevel();
        long gold = (long) Math.floor(props.reward().goldPerLevel() * level * enemy.goldMultiplier());
        long experience = (long) Math.floor(props.reward().xpPerLevel() * level * enemy.xpMultiplier());
        LootDrop loot = retryExecutor.execute("擲出戰利品",
                () -> contentProvider.selectLoot(session.getLocationId(), level, enemy));
        return RewardBundle.victory(gold, experience, loot);
    }

    private RewardBundle applyGrants(CombatSession session, RewardBundle bundle) {
        Long userId = session.getUserId();
        String sessionId = session.getSessionId();

        for (MaterialReward m : bundle.materials()) {
            String key = m.grantKey();
            if (session.isGrantCompleted(key)) continue;
            retryExecutor.run("發放素材 " + m.materialId(),
                    () -> materialRepository.incrementStack(userId, m.materialId(), m.styleId(), m.quantity()));
            completeGrant(session, key, bundle);
        }

        List<ItemReward> items = new ArrayList<>(bundle.items());
        for (int i = 0; i < items.size(); i++) {
            String key = "item:" + i;
            if (session.isGrantCompleted(key)) continue;
            ItemReward item = items.get(i);
            Long itemId = retryExecutor.execute("建立物品 " + item.itemTypeId(),
                    () -> itemRepository.create(userId, item.itemTypeId(), session.getCombatLevel(), item.styleId()));
            items.set(i, item.withCreatedItemId(itemId));
            bundle = bundle.withItems(items);
            completeGrant(session, key, bundle);
        }

        String goldKey = "currency:" + GOLD;
        if (bundle.gold() > 0 && !session.isGrantCompleted(goldKey)) {
            long gold = bundle.gold();
            retryExecutor.execute("發放金幣",
                    () -> currencyLedger.applyDelta(userId, GOLD, gold, SOURCE_COMBAT, sessionId));
            completeGrant(session, goldKey, bundle);
        }

        if (bundle.experience() > 0 && !session.isGrantCompleted("experience")) {
            long experience = bundle.experience();
            LevelUpResult levelUp = retryExecutor.execute("發放經驗值",
                    () -> progressionRepository.addExperience(userId, experience));
            bundle = bundle.withLevelUp(levelUp);
            completeGrant(session, "experience", bundle);
        }

        if (!session.isGrantCompleted("history")) {
            CombatStatus outcome = bundle.outcome();
            CombatHistorySnapshot history = retryExecutor.execute("更新戰績",
                    () -> historyRepository.upsert(userId, session.getLocationId(), outcome));
            bundle = bundle.withHistory(history);
            completeGrant(session, "history", bundle);
        }
        return bundle;
    }

    private void completeGrant(CombatSession session, String key, RewardBundle bundle) {
        session.setPendingRewards(bundle);
        session.markGrantCompleted(key);
        sessionStore.put(session);
    }

    private void saveMarker(CombatSession session, RewardBundle bundle) {
        CombatSettlement marker = CombatSettlement.builder()
                .sessionId(session.getSessionId())
                .userId(session.getUserId())
                .locationId(session.getLocationId())
                .outcome(bundle.outcome())
                .rewardJson(objectMapper.writeValueAsString(bundle))
                .build();
        retryExecutor.execute("寫入結算標記", () -> settlementRepo.save(marker));
    }

    private Optional<RewardBundle> findSettled(String sessionId) {
        return settlementRepo.findBySessionId(sessionId)
                .map(marker -> objectMapper.readValue(marker.getRewardJson(), RewardBundle.class));
    }

    private static boolean isRetryable(RuntimeException e) {
        if (e instanceof ValidationException || e instanceof NotFoundException) {
            return false;
        }
        return !(e instanceof ExternalDependencyException ede) || ede.isRetryable();
    }
}
