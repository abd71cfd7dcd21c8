package com.aiinpocket.combat.model.enums;

/** 回合行動類型 */
public enum CombatAction {
    ATTACK,
    DEFEND
}
