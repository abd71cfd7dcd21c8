package com.aiinpocket.combat.service;

import com.aiinpocket.combat.exception.ExternalDependencyException;
import com.aiinpocket.combat.exception.ValidationException;
import com.aiinpocket.combat.gateway.MaterialRepository;
import com.aiinpocket.combat.model.entity.MaterialStack;
import com.aiinpocket.combat.repository.MaterialStackRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * 素材堆疊 upsert。
 * 先以 UPDATE 累加；堆疊不存在才 INSERT。兩個請求同時 INSERT 時，
 * 晚到的一方會撞到 uk_material_stack，改回 UPDATE 累加。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MaterialStackService implements MaterialRepository {

    private final MaterialStackRepository stackRepo;

    @Override
    public void incrementStack(Long userId, String materialId, String styleId, int quantity) {
        if (quantity <= 0) {
            throw new ValidationException("素材數量必須大於 0: " + quantity);
        }
        if (stackRepo.incrementQuantity(userId, materialId, styleId, quantity, Instant.now()) > 0) {
            return;
        }

        try {
            stackRepo.saveAndFlush(MaterialStack.builder()
                    .userId(userId)
                    .materialId(materialId)
                    .styleId(styleId)
                    .quantity(quantity)
                    .build());
            log.debug("[素材] 用戶 {} 新增堆疊 {}/{} x{}", userId, materialId, styleId, quantity);
        } catch (DataIntegrityViolationException e) {
            log.debug("[素材] 用戶 {} 堆疊 {}/{} 已被並發建立，改為累加", userId, materialId, styleId);
            if (stackRepo.incrementQuantity(userId, materialId, styleId, quantity, Instant.now()) == 0) {
                throw new ExternalDependencyException("素材堆疊寫入失敗: " + materialId, e);
            }
        }
    }
}
