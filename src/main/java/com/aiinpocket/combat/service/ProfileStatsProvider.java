package com.aiinpocket.combat.service;

import com.aiinpocket.combat.config.CombatProperties;
import com.aiinpocket.combat.exception.NotFoundException;
import com.aiinpocket.combat.gateway.PlayerStatsProvider;
import com.aiinpocket.combat.model.domain.PlayerStats;
import com.aiinpocket.combat.model.domain.WeaponBands;
import com.aiinpocket.combat.model.entity.PlayerProfile;
import com.aiinpocket.combat.model.entity.WeaponBandConfig;
import com.aiinpocket.combat.repository.PlayerProfileRepository;
import com.aiinpocket.combat.repository.WeaponBandConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 從玩家角色資料讀取開戰用的數值快照。
 * 未裝備武器、或武器沒有轉盤設定時，使用預設轉盤區域。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProfileStatsProvider implements PlayerStatsProvider {

    private final PlayerProfileRepository profileRepo;
    private final WeaponBandConfigRepository bandConfigRepo;
    private final CombatProperties props;

    @Override
    @Transactional(readOnly = true)
    public PlayerStats getEquippedStats(Long userId) {
        PlayerProfile profile = profileRepo.findById(userId)
                .orElseThrow(() -> new NotFoundException("玩家", userId));

        return new PlayerStats(
                profile.getAtk(),
                profile.getDef(),
                profile.getHp(),
                profile.getAccuracy(),
                resolveBands(profile));
    }

    private WeaponBands resolveBands(PlayerProfile profile) {
        String weaponTypeId = profile.getEquippedWeaponTypeId();
        if (weaponTypeId == null) {
            return props.defaultBands().toBands();
        }
        return bandConfigRepo.findById(weaponTypeId)
                .map(ProfileStatsProvider::toBands)
                .orElseGet(() -> {
                    log.warn("[戰鬥] 武器 {} 沒有轉盤設定，改用預設區域", weaponTypeId);
                    return props.defaultBands().toBands();
                });
    }

    private static WeaponBands toBands(WeaponBandConfig config) {
        return new WeaponBands(config.getInjure(), config.getMiss(), config.getGraze(),
                config.getNormal(), config.getCrit());
    }
}
