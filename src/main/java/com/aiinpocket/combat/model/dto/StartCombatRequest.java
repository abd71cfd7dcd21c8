package com.aiinpocket.combat.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * @param combatLevel 未指定時使用玩家目前等級
 */
public record StartCombatRequest(
        @NotBlank String locationId,
        @Min(1) @Max(100) Integer combatLevel
) {}
