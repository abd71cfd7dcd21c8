package com.aiinpocket.combat.service;

import com.aiinpocket.combat.exception.ValidationException;
import com.aiinpocket.combat.gateway.CombatHistoryRepository;
import com.aiinpocket.combat.model.domain.CombatHistorySnapshot;
import com.aiinpocket.combat.model.entity.PlayerCombatHistory;
import com.aiinpocket.combat.model.enums.CombatStatus;
import com.aiinpocket.combat.repository.PlayerCombatHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * 地點戰鬥統計。
 * 勝利：連勝 +1 並更新最長連勝；戰敗：連勝歸零。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CombatHistoryService implements CombatHistoryRepository {

    private final PlayerCombatHistoryRepository historyRepo;

    @Override
    @Transactional
    public CombatHistorySnapshot upsert(Long userId, String locationId, CombatStatus result) {
        if (result == null || !result.isTerminal()) {
            throw new ValidationException("戰鬥結果必須為 VICTORY 或 DEFEAT: " + result);
        }
        PlayerCombatHistory history = historyRepo.findForUpdate(userId, locationId)
                .orElseGet(() -> PlayerCombatHistory.builder()
                        .userId(userId)
                        .locationId(locationId)
                        .build());

        history.setTotalAttempts(history.getTotalAttempts() + 1);
        if (result == CombatStatus.VICTORY) {
            history.setVictories(history.getVictories() + 1);
            history.setCurrentStreak(history.getCurrentStreak() + 1);
            history.setLongestStreak(Math.max(history.getLongestStreak(), history.getCurrentStreak()));
        } else {
            history.setDefeats(history.getDefeats() + 1);
            history.setCurrentStreak(0);
        }
        history.setLastAttemptAt(Instant.now());
        historyRepo.save(history);

        log.debug("[戰績] 用戶 {} @ {}: {} 勝 {} 敗，連勝 {}（最長 {}）", userId, locationId,
                history.getVictories(), history.getDefeats(), history.getCurrentStreak(), history.getLongestStreak());
        return toSnapshot(history);
    }

    static CombatHistorySnapshot toSnapshot(PlayerCombatHistory h) {
        return new CombatHistorySnapshot(h.getLocationId(), h.getTotalAttempts(), h.getVictories(),
                h.getDefeats(), h.getCurrentStreak(), h.getLongestStreak());
    }
}
