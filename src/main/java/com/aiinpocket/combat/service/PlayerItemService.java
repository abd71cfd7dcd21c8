package com.aiinpocket.combat.service;

import com.aiinpocket.combat.gateway.ItemRepository;
import com.aiinpocket.combat.model.entity.PlayerItem;
import com.aiinpocket.combat.repository.PlayerItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class PlayerItemService implements ItemRepository {

    private final PlayerItemRepository itemRepo;

    @Override
    @Transactional
    public Long create(Long userId, String itemTypeId, int level, String styleId) {
        PlayerItem item = itemRepo.save(PlayerItem.builder()
                .userId(userId)
                .itemTypeId(itemTypeId)
                .level(level)
                .styleId(styleId)
                .build());
        log.debug("[物品] 用戶 {} 獲得物品 {} (Lv.{}, 風格 {}) id={}", userId, itemTypeId, level, styleId, item.getId());
        return item.getId();
    }
}
