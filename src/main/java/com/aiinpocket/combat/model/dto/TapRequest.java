package com.aiinpocket.combat.model.dto;

import jakarta.validation.constraints.NotNull;

/** 玩家在轉盤上點擊的角度 [0, 360) */
public record TapRequest(
        @NotNull Double tapDegrees
) {}
